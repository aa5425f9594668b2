package express.mvp.myra.objects.endpoint;

/**
 * Callback for backing-process destruction.
 *
 * @see Endpoint#onDestroyed(DestroyedListener)
 */
@FunctionalInterface
public interface DestroyedListener {

    /**
     * Called when a process that backed the endpoint terminates.
     *
     * @param processId the id of the terminated process
     */
    void onDestroyed(int processId);
}
