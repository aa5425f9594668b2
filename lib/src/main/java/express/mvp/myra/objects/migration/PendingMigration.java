package express.mvp.myra.objects.migration;

import express.mvp.myra.objects.owner.OwnerKey;
import java.util.Objects;

/**
 * An observed process swap that has not yet been confirmed by a registration.
 *
 * @param oldOwnerKey the owner key on the replaced process
 * @param newOwnerKey the owner key on the process taking over
 */
public record PendingMigration(OwnerKey oldOwnerKey, OwnerKey newOwnerKey) {

    public PendingMigration {
        Objects.requireNonNull(oldOwnerKey, "oldOwnerKey");
        Objects.requireNonNull(newOwnerKey, "newOwnerKey");
    }

    /**
     * Checks whether a registration under {@code key} comes from the replaced process.
     *
     * @param key the owner key of the registration
     * @return true if it matches the old owner key
     */
    public boolean isFrom(OwnerKey key) {
        return oldOwnerKey.equals(key);
    }

    /**
     * Checks whether a registration under {@code key} comes from the new process.
     *
     * @param key the owner key of the registration
     * @return true if it matches the new owner key
     */
    public boolean isTo(OwnerKey key) {
        return newOwnerKey.equals(key);
    }
}
