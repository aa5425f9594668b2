package express.mvp.myra.objects.owner;

import express.mvp.myra.objects.endpoint.Subscription;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Handles referenced by one owner under one context.
 *
 * <p>A record also holds the subscription tokens of the lifecycle listeners watching its backing
 * process. The tokens are disposed whenever the listeners are replaced and when the record is
 * released.
 */
public final class OwnerRecord {

    private final OwnerKey key;
    private final Set<Integer> handles = new LinkedHashSet<>();
    private final List<Subscription> subscriptions = new ArrayList<>(2);
    private int contextId;
    private OwnerState state = OwnerState.ACTIVE;

    OwnerRecord(OwnerKey key, int contextId) {
        this.key = Objects.requireNonNull(key, "key");
        this.contextId = contextId;
    }

    public OwnerKey key() {
        return key;
    }

    public int contextId() {
        return contextId;
    }

    public OwnerState state() {
        return state;
    }

    /**
     * Returns a read-only view of the referenced handles, in insertion order.
     *
     * @return the handle set
     */
    public Set<Integer> handles() {
        return Collections.unmodifiableSet(handles);
    }

    public boolean holds(int handle) {
        return handles.contains(handle);
    }

    /**
     * Adds a handle reference.
     *
     * @param handle the handle
     * @return true if the handle was not referenced before
     */
    public boolean addHandle(int handle) {
        return handles.add(handle);
    }

    /**
     * Drops a handle reference.
     *
     * @param handle the handle
     * @return true if the handle was referenced
     */
    public boolean removeHandle(int handle) {
        return handles.remove(handle);
    }

    /**
     * Moves this record to another context in place. Referenced handles are kept.
     *
     * @param newContextId the new context id
     */
    public void reassignContext(int newContextId) {
        this.contextId = newContextId;
        if (state == OwnerState.MIGRATION_PENDING) {
            transitionTo(OwnerState.ACTIVE);
        }
    }

    /**
     * Attempts a state transition.
     *
     * @param newState the desired state
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(OwnerState newState) {
        if (!OwnerState.isValidTransition(state, newState)) {
            return false;
        }
        state = newState;
        return true;
    }

    /**
     * Replaces the lifecycle subscriptions, disposing the previous ones.
     *
     * @param replacements the new subscription tokens
     */
    public void replaceSubscriptions(Subscription... replacements) {
        disposeSubscriptions();
        Collections.addAll(subscriptions, replacements);
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    /** Hands over all handle references, leaving this record empty. */
    Set<Integer> drainHandles() {
        Set<Integer> drained = new LinkedHashSet<>(handles);
        handles.clear();
        return drained;
    }

    /** Disposes subscriptions and marks the record cleared. */
    void release() {
        disposeSubscriptions();
        handles.clear();
        transitionTo(OwnerState.CLEARED);
    }

    private void disposeSubscriptions() {
        for (Subscription subscription : subscriptions) {
            subscription.dispose();
        }
        subscriptions.clear();
    }

    @Override
    public String toString() {
        return "OwnerRecord["
                + key
                + ", context="
                + contextId
                + ", state="
                + state
                + ", handles="
                + handles.size()
                + "]";
    }
}
