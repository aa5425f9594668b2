/**
 * Handle allocation and reference counting.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.objects.handle.HandleStore} - Handle to (object, count) table
 *   <li>{@link express.mvp.myra.objects.handle.IdentityTagStore} - Object identity to handle
 *       lookup contract
 *   <li>{@link express.mvp.myra.objects.handle.WeakIdentityTagStore} - Weak-keyed default
 * </ul>
 */
package express.mvp.myra.objects.handle;
