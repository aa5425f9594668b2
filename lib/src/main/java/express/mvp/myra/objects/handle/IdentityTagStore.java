package express.mvp.myra.objects.handle;

import java.util.OptionalInt;

/**
 * Associates a recoverable handle with an object instance.
 *
 * <p>Tags are keyed by object identity, never by {@link Object#equals(Object)}: two equal but
 * distinct instances carry independent tags. The store lets {@link HandleStore} return the existing
 * handle when the same instance is registered again.
 *
 * <p>Implementations are not required to be thread-safe; the registry calls them from a single
 * control thread.
 *
 * @see WeakIdentityTagStore
 */
public interface IdentityTagStore {

    /**
     * Returns the tag attached to an object.
     *
     * @param object the tagged instance
     * @return the handle, or empty if the object carries no tag
     */
    OptionalInt getTag(Object object);

    /**
     * Attaches a tag to an object, replacing any previous tag.
     *
     * @param object the instance to tag
     * @param handle the handle to attach
     */
    void setTag(Object object, int handle);

    /**
     * Removes the tag from an object. No-op if the object is untagged.
     *
     * @param object the tagged instance
     */
    void clearTag(Object object);
}
