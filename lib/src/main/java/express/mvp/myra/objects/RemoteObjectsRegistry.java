package express.mvp.myra.objects;

import express.mvp.myra.objects.endpoint.DestroyedListener;
import express.mvp.myra.objects.endpoint.Endpoint;
import express.mvp.myra.objects.endpoint.ProcessChangedListener;
import express.mvp.myra.objects.endpoint.Subscription;
import express.mvp.myra.objects.handle.HandleStore;
import express.mvp.myra.objects.migration.MigrationTable;
import express.mvp.myra.objects.migration.PendingMigration;
import express.mvp.myra.objects.owner.OwnerKey;
import express.mvp.myra.objects.owner.OwnerRecord;
import express.mvp.myra.objects.owner.OwnerState;
import express.mvp.myra.objects.owner.OwnerTable;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reference-counted registry of objects exposed to remote endpoints.
 *
 * <p>Each registered object gets an integer handle. A handle stays live while at least one owner
 * (an endpoint on a given backing process, under a given context) references it, and is released
 * exactly once when the last owner lets go: by {@link #remove}, by {@link #clear}, or because the
 * owner's backing process was destroyed.
 *
 * <h2>Process Swaps</h2>
 *
 * <p>When an endpoint's backing process is swapped, the swap is reported before the context on the
 * new process registers anything. The registry records a pending migration and reconciles it with
 * the next registration:
 *
 * <ul>
 *   <li>A registration from the new process under the same context takes over the old owner's
 *       references without changing any reference count
 *   <li>A registration still addressed to the old process but carrying a new context id starts a
 *       fresh owner under the new process
 *   <li>A registration under a new context with no pending migration (a reload on the same
 *       process) updates the owner's context in place
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RemoteObjectsRegistry registry = new RemoteObjectsRegistry();
 *
 * int handle = registry.add(endpoint, contextId, service);
 * Object same = registry.get(handle).orElseThrow();
 *
 * registry.remove(endpoint, contextId, handle);   // released when no owner is left
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. All calls, including endpoint lifecycle events, must arrive on the host's
 * single dispatch thread; each call completes before the next begins.
 */
public final class RemoteObjectsRegistry {

    private static final Logger LOGGER = Logger.getLogger(RemoteObjectsRegistry.class.getName());

    private final RegistryConfig config;
    private final HandleStore handles;
    private final OwnerTable owners = new OwnerTable();
    private final MigrationTable migrations = new MigrationTable();

    /** Creates a registry with {@link RegistryConfig#defaults()}. */
    public RemoteObjectsRegistry() {
        this(RegistryConfig.defaults());
    }

    /**
     * Creates a registry.
     *
     * @param config the configuration
     */
    public RemoteObjectsRegistry(RegistryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.handles =
                new HandleStore(
                        config.newIdentityTagStore(), config.firstHandle(), config.maxHandle());
    }

    /**
     * Registers an object on behalf of an endpoint's current backing process.
     *
     * <p>Registering the same instance again returns the same handle. The handle's reference count
     * grows by at most one per distinct owner.
     *
     * @param endpoint the referencing endpoint
     * @param contextId the endpoint's context id
     * @param object the object to expose
     * @return the object's handle
     * @throws RegistryException if the handle space is exhausted
     */
    public int add(Endpoint endpoint, int contextId, Object object) {
        Objects.requireNonNull(endpoint, "endpoint");
        return add(endpoint, endpoint.backingProcessId(), contextId, object);
    }

    /**
     * Registers an object on behalf of an explicit backing process of an endpoint.
     *
     * <p>Used to address an owner while the endpoint is between processes.
     *
     * @param endpoint the referencing endpoint
     * @param processId the backing process the registration comes from
     * @param contextId the endpoint's context id
     * @param object the object to expose
     * @return the object's handle
     * @throws RegistryException if the handle space is exhausted
     */
    public int add(Endpoint endpoint, int processId, int contextId, Object object) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(object, "object");

        int handle = handles.allocateOrFind(object);
        OwnerRecord owner;
        try {
            owner = resolveOwner(endpoint, OwnerKey.of(endpoint.id(), processId), contextId);
        } catch (RuntimeException e) {
            if (handles.discardUnreferenced(handle)) {
                LOGGER.log(
                        Level.FINE,
                        "{0}: dropped handle {1} after failed registration",
                        new Object[] {config.name(), handle});
            }
            throw e;
        }
        if (owner.addHandle(handle)) {
            handles.reference(handle);
        }
        return handle;
    }

    /**
     * Looks up a registered object.
     *
     * @param handle the handle
     * @return the object, or empty if the handle is unknown or released
     */
    public Optional<Object> get(int handle) {
        return handles.get(handle);
    }

    /**
     * Looks up a registered object of an expected type.
     *
     * @param handle the handle
     * @param type the expected type
     * @param <T> the expected type
     * @return the object, or empty if the handle is unknown, released, or of another type
     */
    public <T> Optional<T> get(int handle, Class<T> type) {
        return handles.get(handle).filter(type::isInstance).map(type::cast);
    }

    /**
     * Drops an endpoint's reference to a handle.
     *
     * <p>Ignored when no owner exists for the endpoint's current process, when the owner's context
     * differs from {@code contextId}, or when the owner does not reference the handle. A handle may
     * therefore be removed twice without affecting other owners.
     *
     * @param endpoint the referencing endpoint
     * @param contextId the context the reference was made under
     * @param handle the handle
     */
    public void remove(Endpoint endpoint, int contextId, int handle) {
        Objects.requireNonNull(endpoint, "endpoint");
        OwnerKey key = OwnerKey.of(endpoint.id(), endpoint.backingProcessId());
        OwnerRecord owner = owners.get(key);
        if (owner == null || owner.contextId() != contextId) {
            LOGGER.log(
                    Level.FINER,
                    "{0}: ignoring stale remove of handle {1} by {2} context {3}",
                    new Object[] {config.name(), handle, key, contextId});
            return;
        }
        if (owner.removeHandle(handle)) {
            handles.dereference(handle);
        }
    }

    /**
     * Releases every reference held by an owner.
     *
     * <p>Ignored when no owner exists for {@code ownerKey} or its context differs from {@code
     * contextId}. Any pending migration of the context is dropped as well.
     *
     * @param ownerKey the owner key
     * @param contextId the owner's context id
     */
    public void clear(OwnerKey ownerKey, int contextId) {
        Objects.requireNonNull(ownerKey, "ownerKey");
        OwnerRecord owner = owners.get(ownerKey);
        if (owner == null || owner.contextId() != contextId) {
            LOGGER.log(
                    Level.FINER,
                    "{0}: ignoring stale clear of {1} context {2}",
                    new Object[] {config.name(), ownerKey, contextId});
            return;
        }

        for (int handle : owner.handles()) {
            handles.dereference(handle);
        }
        int released = owner.handles().size();
        owners.remove(ownerKey);
        migrations.discard(contextId);

        LOGGER.log(
                Level.FINE,
                "{0}: cleared {1} context {2}, {3} handle(s) dereferenced",
                new Object[] {config.name(), ownerKey, contextId, released});
    }

    /**
     * Releases every reference held by an endpoint's current backing process.
     *
     * @param endpoint the endpoint
     * @param contextId the owner's context id
     */
    public void clear(Endpoint endpoint, int contextId) {
        Objects.requireNonNull(endpoint, "endpoint");
        clear(OwnerKey.of(endpoint.id(), endpoint.backingProcessId()), contextId);
    }

    /**
     * Returns the number of owners referencing a handle.
     *
     * @param handle the handle
     * @return the reference count, or 0 if the handle is not live
     */
    public int refCount(int handle) {
        return handles.refCount(handle);
    }

    /**
     * Returns the state of an owner.
     *
     * @param ownerKey the owner key
     * @return the state, or empty if no owner exists for the key
     */
    public Optional<OwnerState> ownerState(OwnerKey ownerKey) {
        return Optional.ofNullable(owners.get(ownerKey)).map(OwnerRecord::state);
    }

    /**
     * Returns the context id of an owner.
     *
     * @param ownerKey the owner key
     * @return the context id, or empty if no owner exists for the key
     */
    public Optional<Integer> ownerContext(OwnerKey ownerKey) {
        return Optional.ofNullable(owners.get(ownerKey)).map(OwnerRecord::contextId);
    }

    /**
     * Returns the handles referenced by an owner.
     *
     * @param ownerKey the owner key
     * @return a copy of the handle set, empty if no owner exists for the key
     */
    public Set<Integer> ownedHandles(OwnerKey ownerKey) {
        OwnerRecord owner = owners.get(ownerKey);
        return owner == null ? Set.of() : Set.copyOf(owner.handles());
    }

    /**
     * Returns the pending migration of a context.
     *
     * @param contextId the context id
     * @return the migration, or empty
     */
    public Optional<PendingMigration> pendingMigration(int contextId) {
        return migrations.find(contextId);
    }

    /**
     * Returns the contexts whose process swap has not been confirmed by a registration.
     *
     * @return a copy of the context ids
     */
    public Set<Integer> pendingMigrationContexts() {
        return Set.copyOf(migrations.contextIds());
    }

    /**
     * Returns an occupancy snapshot.
     *
     * @return the current statistics
     */
    public RegistryStats stats() {
        return new RegistryStats(
                handles.size(),
                owners.size(),
                migrations.size(),
                handles.totalAllocated(),
                handles.totalReleased());
    }

    public RegistryConfig config() {
        return config;
    }

    /** Finds or creates the owner a registration belongs to, reconciling process swaps. */
    private OwnerRecord resolveOwner(Endpoint endpoint, OwnerKey key, int contextId) {
        OwnerRecord owner = owners.get(key);
        if (owner == null) {
            return createOwner(endpoint, key, contextId);
        }
        if (owner.contextId() == contextId) {
            return owner;
        }

        int previousContextId = owner.contextId();
        Optional<PendingMigration> pending =
                migrations.find(previousContextId).filter(m -> m.isFrom(key));
        if (pending.isPresent()) {
            // Confirmation arrived through the old process: start over on the new one.
            migrations.discard(previousContextId);
            OwnerKey newKey = pending.get().newOwnerKey();
            OwnerRecord migrated = owners.get(newKey);
            if (migrated == null) {
                migrated = owners.create(newKey, contextId);
            } else {
                migrated.reassignContext(contextId);
            }
            watch(endpoint, migrated);
            LOGGER.log(
                    Level.FINE,
                    "{0}: context {1} on {2} continues as context {3} on {4}",
                    new Object[] {config.name(), previousContextId, key, contextId, newKey});
            return migrated;
        }

        // Reloaded on the same process.
        owner.reassignContext(contextId);
        watch(endpoint, owner);
        LOGGER.log(
                Level.FINE,
                "{0}: {1} moved from context {2} to {3}",
                new Object[] {config.name(), key, previousContextId, contextId});
        return owner;
    }

    private OwnerRecord createOwner(Endpoint endpoint, OwnerKey key, int contextId) {
        Optional<PendingMigration> inbound = migrations.find(contextId).filter(m -> m.isTo(key));
        OwnerRecord source = inbound.map(m -> owners.get(m.oldOwnerKey())).orElse(null);

        OwnerRecord owner;
        if (source != null && source.contextId() == contextId) {
            migrations.discard(contextId);
            owner = owners.migrate(source.key(), key, contextId);
            LOGGER.log(
                    Level.FINE,
                    "{0}: context {1} migrated from {2} to {3} with {4} handle(s)",
                    new Object[] {
                        config.name(), contextId, source.key(), key, owner.handles().size()
                    });
        } else {
            owner = owners.create(key, contextId);
            LOGGER.log(
                    Level.FINE,
                    "{0}: owner {1} created for context {2}",
                    new Object[] {config.name(), key, contextId});
        }
        watch(endpoint, owner);
        return owner;
    }

    /** Subscribes the one-shot lifecycle listeners of an owner, replacing earlier ones. */
    private void watch(Endpoint endpoint, OwnerRecord owner) {
        DestroyedWatcher destroyed = new DestroyedWatcher(owner.key(), owner.contextId());
        ProcessSwapWatcher swapped = new ProcessSwapWatcher(owner.key(), owner.contextId());
        destroyed.subscription = endpoint.onDestroyed(destroyed);
        swapped.subscription = endpoint.onProcessChanged(swapped);
        owner.replaceSubscriptions(destroyed.subscription, swapped.subscription);
    }

    /** Clears an owner when its backing process is destroyed. */
    private final class DestroyedWatcher implements DestroyedListener {
        private final OwnerKey ownerKey;
        private final int contextId;
        private Subscription subscription;

        DestroyedWatcher(OwnerKey ownerKey, int contextId) {
            this.ownerKey = ownerKey;
            this.contextId = contextId;
        }

        @Override
        public void onDestroyed(int processId) {
            if (processId != ownerKey.processId()) {
                return;
            }
            subscription.dispose();
            clear(ownerKey, contextId);
        }
    }

    /** Records a pending migration when an owner's backing process is swapped. */
    private final class ProcessSwapWatcher implements ProcessChangedListener {
        private final OwnerKey ownerKey;
        private final int contextId;
        private Subscription subscription;

        ProcessSwapWatcher(OwnerKey ownerKey, int contextId) {
            this.ownerKey = ownerKey;
            this.contextId = contextId;
        }

        @Override
        public void onProcessChanged(int oldProcessId, int newProcessId) {
            if (oldProcessId != ownerKey.processId()) {
                return;
            }
            OwnerRecord owner = owners.get(ownerKey);
            if (owner == null) {
                return;
            }
            PendingMigration migration =
                    new PendingMigration(ownerKey, ownerKey.withProcess(newProcessId));
            migrations.record(contextId, migration);
            owner.transitionTo(OwnerState.MIGRATION_PENDING);
            subscription.dispose();
            LOGGER.log(
                    Level.FINE,
                    "{0}: context {1} migrating {2} -> {3}",
                    new Object[] {config.name(), contextId, ownerKey, migration.newOwnerKey()});
        }
    }

    @Override
    public String toString() {
        return "RemoteObjectsRegistry[" + config.name() + ", " + stats() + "]";
    }
}
