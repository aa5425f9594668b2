package express.mvp.myra.objects;

/**
 * Immutable snapshot of registry occupancy.
 *
 * <p>The snapshot is useful for leak checks: once every endpoint has been destroyed or cleared,
 * {@link #liveHandles()} and {@link #owners()} should both be zero. A non-zero {@link
 * #pendingMigrations()} at that point indicates swaps whose confirming registration never arrived.
 *
 * @param liveHandles handles currently referenced by at least one owner
 * @param owners owner records currently tracked
 * @param pendingMigrations migrations waiting for a confirming registration
 * @param totalAllocated handles allocated since the registry was created
 * @param totalReleased handles released since the registry was created
 */
public record RegistryStats(
        int liveHandles,
        int owners,
        int pendingMigrations,
        long totalAllocated,
        long totalReleased) {

    /**
     * Checks whether the registry holds no references.
     *
     * @return true if no handles and no owners remain
     */
    public boolean isEmpty() {
        return liveHandles == 0 && owners == 0;
    }
}
