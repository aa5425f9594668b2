package express.mvp.myra.objects.owner;

import java.util.HashMap;
import java.util.Map;

/**
 * Owner records by owner key. At most one record exists per key.
 *
 * <p>The table never touches reference counts: callers dereference a record's handles before
 * {@link #remove(OwnerKey)}, while {@link #migrate(OwnerKey, OwnerKey, int)} moves references
 * without changing them.
 */
public final class OwnerTable {

    private final Map<OwnerKey, OwnerRecord> owners = new HashMap<>();

    /**
     * Looks up a record.
     *
     * @param key the owner key
     * @return the record, or null if none exists
     */
    public OwnerRecord get(OwnerKey key) {
        return owners.get(key);
    }

    /**
     * Creates an empty record.
     *
     * @param key the owner key
     * @param contextId the owner's context id
     * @return the new record
     * @throws IllegalStateException if a record already exists for the key
     */
    public OwnerRecord create(OwnerKey key, int contextId) {
        if (owners.containsKey(key)) {
            throw new IllegalStateException("Owner already registered: " + key);
        }
        OwnerRecord record = new OwnerRecord(key, contextId);
        owners.put(key, record);
        return record;
    }

    /**
     * Moves the references of one record to a new record under another key.
     *
     * <p>The source record is released and removed. Reference counts are unaffected because the
     * set of handles held per owner is unchanged.
     *
     * @param fromKey the key of the record being migrated
     * @param toKey the key of the new record
     * @param contextId the context id of the new record
     * @return the new record
     * @throws IllegalStateException if the source is missing or the target already exists
     */
    public OwnerRecord migrate(OwnerKey fromKey, OwnerKey toKey, int contextId) {
        OwnerRecord source = owners.get(fromKey);
        if (source == null) {
            throw new IllegalStateException("No owner to migrate: " + fromKey);
        }
        OwnerRecord target = create(toKey, contextId);
        for (int handle : source.drainHandles()) {
            target.addHandle(handle);
        }
        remove(fromKey);
        return target;
    }

    /**
     * Removes and releases a record.
     *
     * @param key the owner key
     * @return the removed record, or null if none existed
     */
    public OwnerRecord remove(OwnerKey key) {
        OwnerRecord record = owners.remove(key);
        if (record != null) {
            record.release();
        }
        return record;
    }

    public int size() {
        return owners.size();
    }
}
