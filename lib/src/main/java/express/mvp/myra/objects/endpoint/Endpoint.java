package express.mvp.myra.objects.endpoint;

/**
 * A peer that references registered objects.
 *
 * <p>An endpoint has a stable id and is backed by one process at a time. The backing process may
 * be destroyed, or transparently swapped for another one; both are reported through one-shot
 * capable listener subscriptions.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Subscription sub = endpoint.onDestroyed(pid -> {
 *     if (pid == watchedPid) {
 *         cleanup();
 *     }
 * });
 * // ... later, stop listening
 * sub.dispose();
 * }</pre>
 *
 * @see HostedEndpoint
 * @see EndpointEvents
 */
public interface Endpoint {

    /**
     * Returns the stable endpoint id.
     *
     * @return the endpoint id
     */
    int id();

    /**
     * Returns the id of the process currently backing this endpoint.
     *
     * @return the backing process id
     */
    int backingProcessId();

    /**
     * Subscribes to backing-process destruction.
     *
     * @param listener the listener to register
     * @return a token that unsubscribes the listener when disposed
     */
    Subscription onDestroyed(DestroyedListener listener);

    /**
     * Subscribes to backing-process swaps.
     *
     * @param listener the listener to register
     * @return a token that unsubscribes the listener when disposed
     */
    Subscription onProcessChanged(ProcessChangedListener listener);
}
