package express.mvp.myra.objects.endpoint;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Endpoint implementation for hosts that track their own backing processes.
 *
 * <p>The host calls {@link #swapProcess(int)} when it moves the endpoint onto another process and
 * {@link #processDestroyed(int)} (or {@link #destroy()}) when a process terminates.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * HostedEndpoint frame = new HostedEndpoint(1, 1001);
 * int handle = registry.add(frame, contextId, service);
 *
 * frame.swapProcess(1002);   // registry records a pending migration
 * frame.destroy();           // registry clears the owner backed by 1002
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. Events are expected on the host's dispatch thread.
 */
public final class HostedEndpoint implements Endpoint {

    private final int id;
    private final EndpointEvents events;
    private int processId;

    /**
     * Creates an endpoint.
     *
     * @param id stable endpoint id
     * @param processId initial backing process id
     */
    public HostedEndpoint(int id, int processId) {
        this.id = id;
        this.processId = processId;
        this.events = new EndpointEvents("endpoint-" + id);
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public int backingProcessId() {
        return processId;
    }

    @Override
    public Subscription onDestroyed(DestroyedListener listener) {
        return events.subscribeDestroyed(listener);
    }

    @Override
    public Subscription onProcessChanged(ProcessChangedListener listener) {
        return events.subscribeProcessChanged(listener);
    }

    /**
     * Moves the endpoint onto a new backing process and notifies listeners.
     *
     * @param newProcessId the new process id
     */
    public void swapProcess(int newProcessId) {
        int oldProcessId = processId;
        processId = newProcessId;
        events.fireProcessChanged(oldProcessId, newProcessId);
    }

    /**
     * Reports termination of a process that backs, or used to back, this endpoint.
     *
     * @param terminatedProcessId the terminated process id
     */
    public void processDestroyed(int terminatedProcessId) {
        events.fireDestroyed(terminatedProcessId);
    }

    /** Reports termination of the current backing process. */
    public void destroy() {
        processDestroyed(processId);
    }

    /**
     * Returns the event source, for inspection of live subscriptions.
     *
     * @return the event source
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Event source is shared with the host for subscription inspection.")
    public EndpointEvents events() {
        return events;
    }

    @Override
    public String toString() {
        return "HostedEndpoint[" + id + "@" + processId + "]";
    }
}
