/**
 * Reconciliation of process swaps with the registrations that follow them.
 *
 * <p>A swap is reported before the context on the new process registers anything. The {@link
 * express.mvp.myra.objects.migration.MigrationTable} bridges that gap: it remembers, per context id,
 * which owner key was replaced and which key takes over.
 */
package express.mvp.myra.objects.migration;
