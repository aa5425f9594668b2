package express.mvp.myra.objects.endpoint;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener registry and dispatcher for endpoint lifecycle events.
 *
 * <p>Endpoint implementations delegate their {@code onDestroyed} / {@code onProcessChanged}
 * subscriptions to this class and call {@link #fireDestroyed(int)} or {@link
 * #fireProcessChanged(int, int)} when the host reports an event.
 *
 * <h2>Dispatch Rules</h2>
 *
 * <ul>
 *   <li>Listeners run in subscription order
 *   <li>A listener may dispose its own or any other subscription during dispatch; disposed
 *       listeners are skipped for the rest of the dispatch
 *   <li>A listener that throws is logged and the remaining listeners still run
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointEvents events = new EndpointEvents("frame-3");
 * Subscription sub = events.subscribeDestroyed(pid -> logger.info("gone: " + pid));
 * events.fireDestroyed(42);
 * sub.dispose();
 * }</pre>
 *
 * @see HostedEndpoint
 */
public final class EndpointEvents {

    private static final Logger LOGGER = Logger.getLogger(EndpointEvents.class.getName());

    private final List<Registration<DestroyedListener>> destroyedListeners =
            new CopyOnWriteArrayList<>();

    private final List<Registration<ProcessChangedListener>> processChangedListeners =
            new CopyOnWriteArrayList<>();

    /** Identifier used in log messages. */
    private final String name;

    /**
     * Creates an event source.
     *
     * @param name identifier for log messages
     */
    public EndpointEvents(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Registers a destruction listener.
     *
     * @param listener the listener
     * @return the subscription token
     */
    public Subscription subscribeDestroyed(DestroyedListener listener) {
        return register(destroyedListeners, Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a process-swap listener.
     *
     * @param listener the listener
     * @return the subscription token
     */
    public Subscription subscribeProcessChanged(ProcessChangedListener listener) {
        return register(processChangedListeners, Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Notifies destruction listeners.
     *
     * @param processId the terminated process
     */
    public void fireDestroyed(int processId) {
        dispatch(destroyedListeners, l -> l.onDestroyed(processId), "destroyed");
    }

    /**
     * Notifies process-swap listeners.
     *
     * @param oldProcessId the replaced process
     * @param newProcessId the new process
     */
    public void fireProcessChanged(int oldProcessId, int newProcessId) {
        dispatch(
                processChangedListeners,
                l -> l.onProcessChanged(oldProcessId, newProcessId),
                "process-changed");
    }

    /**
     * Returns the number of live destruction subscriptions.
     *
     * @return listener count
     */
    public int destroyedListenerCount() {
        return destroyedListeners.size();
    }

    /**
     * Returns the number of live process-swap subscriptions.
     *
     * @return listener count
     */
    public int processChangedListenerCount() {
        return processChangedListeners.size();
    }

    private static <L> Subscription register(List<Registration<L>> listeners, L listener) {
        Registration<L> registration = new Registration<>(listener, listeners);
        listeners.add(registration);
        return registration;
    }

    private <L> void dispatch(
            List<Registration<L>> listeners, Consumer<L> invoker, String eventName) {
        for (Registration<L> registration : listeners) {
            if (registration.isDisposed()) {
                continue;
            }
            try {
                invoker.accept(registration.listener);
            } catch (RuntimeException e) {
                LOGGER.log(
                        Level.WARNING,
                        "Endpoint " + name + " " + eventName + " listener failed",
                        e);
            }
        }
    }

    private static final class Registration<L> implements Subscription {
        private final L listener;
        private final List<Registration<L>> owner;
        private boolean disposed;

        Registration(L listener, List<Registration<L>> owner) {
            this.listener = listener;
            this.owner = owner;
        }

        @Override
        public void dispose() {
            if (disposed) {
                return;
            }
            disposed = true;
            owner.remove(this);
        }

        @Override
        public boolean isDisposed() {
            return disposed;
        }
    }

    @Override
    public String toString() {
        return "EndpointEvents["
                + name
                + ", destroyed="
                + destroyedListeners.size()
                + ", processChanged="
                + processChangedListeners.size()
                + "]";
    }
}
