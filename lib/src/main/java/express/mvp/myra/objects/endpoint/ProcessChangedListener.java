package express.mvp.myra.objects.endpoint;

/**
 * Callback for a transparent swap of the endpoint's backing process.
 *
 * <p>Hosts may swap through several intermediate processes before the final one settles; each
 * swap is reported separately.
 *
 * @see Endpoint#onProcessChanged(ProcessChangedListener)
 */
@FunctionalInterface
public interface ProcessChangedListener {

    /**
     * Called when the backing process has been swapped.
     *
     * @param oldProcessId the process being replaced
     * @param newProcessId the process taking over
     */
    void onProcessChanged(int oldProcessId, int newProcessId);
}
