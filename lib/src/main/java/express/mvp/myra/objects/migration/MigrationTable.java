package express.mvp.myra.objects.migration;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pending migrations by context id.
 *
 * <p>An entry is written when a process swap is observed and is consumed by the registration that
 * confirms it, or dropped when the context is cleared. Entries whose confirming registration never
 * arrives are retained; {@link #contextIds()} exposes them for inspection.
 */
public final class MigrationTable {

    private static final Logger LOGGER = Logger.getLogger(MigrationTable.class.getName());

    private final Map<Integer, PendingMigration> pending = new HashMap<>();

    /**
     * Records a migration for a context, replacing any earlier one.
     *
     * @param contextId the context id
     * @param migration the observed swap
     */
    public void record(int contextId, PendingMigration migration) {
        PendingMigration previous = pending.put(contextId, migration);
        if (previous != null) {
            LOGGER.log(
                    Level.FINE,
                    "Context {0}: migration {1} superseded by {2}",
                    new Object[] {contextId, previous, migration});
        }
    }

    /**
     * Looks up the migration for a context.
     *
     * @param contextId the context id
     * @return the pending migration, or empty
     */
    public Optional<PendingMigration> find(int contextId) {
        return Optional.ofNullable(pending.get(contextId));
    }

    /**
     * Drops the migration for a context.
     *
     * @param contextId the context id
     * @return true if an entry was removed
     */
    public boolean discard(int contextId) {
        return pending.remove(contextId) != null;
    }

    public int size() {
        return pending.size();
    }

    /**
     * Returns the context ids with a pending migration.
     *
     * @return read-only view of the context ids
     */
    public Set<Integer> contextIds() {
        return Collections.unmodifiableSet(pending.keySet());
    }
}
