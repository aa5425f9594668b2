package express.mvp.myra.objects.endpoint;

/**
 * Token returned when a listener is subscribed.
 *
 * <p>Disposing the token unsubscribes the listener. Disposal is idempotent.
 */
public interface Subscription {

    /** Unsubscribes the listener. Subsequent calls have no effect. */
    void dispose();

    /**
     * Checks whether this subscription has been disposed.
     *
     * @return true once {@link #dispose()} has been called
     */
    boolean isDisposed();
}
