/**
 * Owner tracking: which endpoint, on which backing process, references which handles.
 *
 * @see express.mvp.myra.objects.owner.OwnerTable
 * @see express.mvp.myra.objects.owner.OwnerState
 */
package express.mvp.myra.objects.owner;
