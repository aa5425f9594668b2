package express.mvp.myra.objects.handle;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Identity tag side table with weakly referenced keys.
 *
 * <p>The store never injects anything into the tagged object, and it never keeps an object alive:
 * once an instance becomes unreachable its entry is purged on the next access. Keys compare by
 * reference identity ({@code ==}) and hash with {@link System#identityHashCode(Object)}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * IdentityTagStore tags = new WeakIdentityTagStore();
 * tags.setTag(service, 7);
 * tags.getTag(service);          // OptionalInt[7]
 * tags.getTag(new Service());    // OptionalInt.empty, different instance
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. Callers must serialize access.
 */
public final class WeakIdentityTagStore implements IdentityTagStore {

    private final Map<IdentityKey, Integer> tags = new HashMap<>();

    /** Receives keys whose referent has been collected. */
    private final ReferenceQueue<Object> collected = new ReferenceQueue<>();

    @Override
    public OptionalInt getTag(Object object) {
        Objects.requireNonNull(object, "object");
        expungeCollected();
        Integer handle = tags.get(new IdentityKey(object, null));
        return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
    }

    @Override
    public void setTag(Object object, int handle) {
        Objects.requireNonNull(object, "object");
        expungeCollected();
        tags.put(new IdentityKey(object, collected), handle);
    }

    @Override
    public void clearTag(Object object) {
        Objects.requireNonNull(object, "object");
        expungeCollected();
        tags.remove(new IdentityKey(object, null));
    }

    /**
     * Returns the number of live tags after purging collected keys.
     *
     * @return tag count
     */
    public int size() {
        expungeCollected();
        return tags.size();
    }

    private void expungeCollected() {
        Reference<?> ref;
        while ((ref = collected.poll()) != null) {
            tags.remove(ref);
        }
    }

    /** Weak key with identity semantics. A cleared key only equals itself. */
    private static final class IdentityKey extends WeakReference<Object> {
        private final int hash;

        IdentityKey(Object referent, ReferenceQueue<Object> queue) {
            super(referent, queue);
            this.hash = System.identityHashCode(referent);
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof IdentityKey)) {
                return false;
            }
            Object referent = get();
            return referent != null && referent == ((IdentityKey) other).get();
        }
    }
}
