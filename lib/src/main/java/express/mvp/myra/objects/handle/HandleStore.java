package express.mvp.myra.objects.handle;

import express.mvp.myra.objects.RegistryException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reference-counted table of registered objects keyed by integer handle.
 *
 * <p>Handles are allocated monotonically and are never reused. An entry exists from the first
 * registration of an object until its live count drops back to zero; at that moment the entry is
 * deleted and the object's identity tag is cleared, so registering the same instance again yields a
 * fresh, strictly greater handle.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * allocateOrFind(obj) → entry(count=0)
 * reference(h)        → count + 1
 * dereference(h)      → count - 1, entry deleted at 0
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. The store is owned by a single registry and mutated from its control thread.
 */
public final class HandleStore {

    /** Live entries by handle. */
    private final Map<Integer, Entry> entries = new HashMap<>();

    private final IdentityTagStore tags;

    /** Largest handle this store may hand out. */
    private final int maxHandle;

    /** Next handle to allocate. Held as long so the counter itself cannot wrap. */
    private long nextHandle;

    /** Total handles allocated (cumulative). */
    private long totalAllocated;

    /** Total handles released (cumulative). */
    private long totalReleased;

    /**
     * Creates a store.
     *
     * @param tags identity tag side table
     * @param firstHandle first handle value to allocate (at least 1)
     * @param maxHandle largest handle value to allocate
     */
    public HandleStore(IdentityTagStore tags, int firstHandle, int maxHandle) {
        if (firstHandle < 1) {
            throw new IllegalArgumentException("firstHandle must be >= 1: " + firstHandle);
        }
        if (maxHandle < firstHandle) {
            throw new IllegalArgumentException(
                    "maxHandle must be >= firstHandle: " + maxHandle + " < " + firstHandle);
        }
        this.tags = Objects.requireNonNull(tags, "tags");
        this.nextHandle = firstHandle;
        this.maxHandle = maxHandle;
    }

    /**
     * Returns the handle of an already-tagged object, or allocates a new entry with count 0.
     *
     * @param object the object to register
     * @return the object's handle
     * @throws RegistryException if the handle space is exhausted
     */
    public int allocateOrFind(Object object) {
        Objects.requireNonNull(object, "object");
        OptionalInt tag = tags.getTag(object);
        if (tag.isPresent()) {
            Entry entry = entries.get(tag.getAsInt());
            if (entry != null && entry.object == object) {
                return tag.getAsInt();
            }
            // Tag left behind by a released handle.
            tags.clearTag(object);
        }

        if (nextHandle > maxHandle) {
            throw new RegistryException("Handle space exhausted (max " + maxHandle + ")");
        }
        int handle = (int) nextHandle++;
        entries.put(handle, new Entry(object));
        tags.setTag(object, handle);
        totalAllocated++;
        return handle;
    }

    /**
     * Looks up the object behind a handle.
     *
     * @param handle the handle
     * @return the object, or empty if the handle is unknown or released
     */
    public Optional<Object> get(int handle) {
        Entry entry = entries.get(handle);
        return entry == null ? Optional.empty() : Optional.of(entry.object);
    }

    /**
     * Increments the live count of a handle.
     *
     * @param handle the handle
     * @return true if the entry exists and was incremented
     */
    public boolean reference(int handle) {
        Entry entry = entries.get(handle);
        if (entry == null) {
            return false;
        }
        entry.count++;
        return true;
    }

    /**
     * Decrements the live count of a handle, releasing the entry at zero.
     *
     * <p>Unknown handles are ignored, so a handle may safely be released twice.
     *
     * @param handle the handle
     * @return true if this call released the entry
     */
    public boolean dereference(int handle) {
        Entry entry = entries.get(handle);
        if (entry == null) {
            return false;
        }
        entry.count--;
        if (entry.count > 0) {
            return false;
        }
        tags.clearTag(entry.object);
        entries.remove(handle);
        totalReleased++;
        return true;
    }

    /**
     * Deletes an entry that no owner has referenced yet.
     *
     * <p>Used to undo {@link #allocateOrFind(Object)} when the registration it belonged to fails.
     * Entries with a positive count are left untouched.
     *
     * @param handle the handle
     * @return true if an unreferenced entry was deleted
     */
    public boolean discardUnreferenced(int handle) {
        Entry entry = entries.get(handle);
        if (entry == null || entry.count > 0) {
            return false;
        }
        tags.clearTag(entry.object);
        entries.remove(handle);
        totalReleased++;
        return true;
    }

    /**
     * Returns the live count of a handle.
     *
     * @param handle the handle
     * @return the count, or 0 if the handle is unknown
     */
    public int refCount(int handle) {
        Entry entry = entries.get(handle);
        return entry == null ? 0 : entry.count;
    }

    /**
     * Checks whether a handle is live.
     *
     * @param handle the handle
     * @return true if an entry exists
     */
    public boolean contains(int handle) {
        return entries.containsKey(handle);
    }

    /**
     * Returns the number of live entries.
     *
     * @return live entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the cumulative number of allocated handles.
     *
     * @return allocation count
     */
    public long totalAllocated() {
        return totalAllocated;
    }

    /**
     * Returns the cumulative number of released handles.
     *
     * @return release count
     */
    public long totalReleased() {
        return totalReleased;
    }

    private static final class Entry {
        private final Object object;
        private int count;

        Entry(Object object) {
            this.object = object;
        }
    }
}
