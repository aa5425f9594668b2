package express.mvp.myra.objects.owner;

/**
 * Identity of an owner: an endpoint as seen through one backing process.
 *
 * <p>The same endpoint yields a different key after its backing process is swapped.
 *
 * @param endpointId the stable endpoint id
 * @param processId the observed backing process id
 */
public record OwnerKey(int endpointId, int processId) {

    /**
     * Creates a key.
     *
     * @param endpointId the stable endpoint id
     * @param processId the observed backing process id
     * @return the key
     */
    public static OwnerKey of(int endpointId, int processId) {
        return new OwnerKey(endpointId, processId);
    }

    /**
     * Returns the key of the same endpoint on another process.
     *
     * @param newProcessId the other process id
     * @return the derived key
     */
    public OwnerKey withProcess(int newProcessId) {
        return new OwnerKey(endpointId, newProcessId);
    }

    @Override
    public String toString() {
        return endpointId + "-" + processId;
    }
}
