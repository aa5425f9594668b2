/**
 * Reference-counted registry of objects exposed to remote endpoints.
 *
 * <p>The registry hands out integer handles for local objects referenced by peer endpoints and
 * releases each object exactly once when every referencing owner has gone away, including across
 * transparent swaps of an endpoint's backing process.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.objects.RemoteObjectsRegistry} - The registry facade
 *   <li>{@link express.mvp.myra.objects.RegistryConfig} - Handle range and tag store selection
 *   <li>{@link express.mvp.myra.objects.RegistryStats} - Occupancy snapshot for leak checks
 * </ul>
 *
 * @see express.mvp.myra.objects.handle.HandleStore
 * @see express.mvp.myra.objects.owner.OwnerTable
 * @see express.mvp.myra.objects.migration.MigrationTable
 */
package express.mvp.myra.objects;
