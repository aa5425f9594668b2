package express.mvp.myra.objects;

/**
 * Unchecked exception thrown when the registry cannot complete an operation.
 *
 * <p>Stale or mismatched calls are never reported this way; they are ignored. This exception only
 * signals conditions the registry cannot recover from, such as running out of handle values.
 */
public class RegistryException extends RuntimeException {

    /**
     * Constructs a new registry exception with the specified message.
     *
     * @param message the detail message
     */
    public RegistryException(String message) {
        super(message);
    }
}
