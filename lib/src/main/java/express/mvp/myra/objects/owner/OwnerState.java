package express.mvp.myra.objects.owner;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an owner record.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * ACTIVE            → MIGRATION_PENDING, CLEARED
 * MIGRATION_PENDING → ACTIVE, CLEARED
 * CLEARED           → (terminal, no transitions)
 * </pre>
 *
 * <p>A record leaves {@code MIGRATION_PENDING} for {@code ACTIVE} when the same key is
 * re-registered under a new context without a matching migration.
 */
public enum OwnerState {

    /** Registered and listening for lifecycle events. */
    ACTIVE,

    /** A process swap was observed; waiting for the confirming registration. */
    MIGRATION_PENDING,

    /** Released by a destruction event, an explicit clear, or a migration. */
    CLEARED;

    private static final Set<OwnerState> FROM_ACTIVE = EnumSet.of(MIGRATION_PENDING, CLEARED);

    private static final Set<OwnerState> FROM_MIGRATION_PENDING = EnumSet.of(ACTIVE, CLEARED);

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(OwnerState from, OwnerState to) {
        return switch (from) {
            case ACTIVE -> FROM_ACTIVE.contains(to);
            case MIGRATION_PENDING -> FROM_MIGRATION_PENDING.contains(to);
            case CLEARED -> false;
        };
    }

    /**
     * Checks if this is the terminal state.
     *
     * @return true for {@link #CLEARED}
     */
    public boolean isCleared() {
        return this == CLEARED;
    }
}
