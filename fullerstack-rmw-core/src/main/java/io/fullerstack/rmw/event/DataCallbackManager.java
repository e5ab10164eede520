package io.fullerstack.rmw.event;

/**
 * Manages the callback fired when a new message, request or response reaches an entity.
 * <p>
 * Same catch-up contract as the per-kind status callbacks: arrivals before a callback is
 * registered are counted and replayed synchronously inside {@link #setCallback}.
 */
public final class DataCallbackManager {

    private final CallbackSlot slot;

    public DataCallbackManager() {
        this("new-data");
    }

    public DataCallbackManager(String name) {
        this.slot = new CallbackSlot(name);
    }

    /**
     * Sets the callback to run when new data is received.
     *
     * @param callback the callback, or {@code null} to unregister
     * @param userData data passed to the callback
     */
    public void setCallback(EventCallback callback, Object userData) {
        slot.set(callback, userData);
    }

    /** Triggers the user callback, or records the arrival if none is set. */
    public void triggerCallback() {
        slot.trigger();
    }

    public long unreadCount() {
        return slot.pendingCount();
    }
}
