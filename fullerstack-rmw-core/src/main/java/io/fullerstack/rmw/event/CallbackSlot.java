package io.fullerstack.rmw.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holder of an optional {@link EventCallback} plus its user data, with catch-up for
 * triggers raised before a callback was registered.
 * <p>
 * <b>Invariant:</b> while a callback is registered the pending count is 0, every trigger is
 * delivered immediately. While none is registered triggers accumulate; registering a callback
 * replays each accumulated trigger exactly once and resets the count.
 * <p>
 * The callback always runs after the slot's lock has been released, so a callback may
 * re-register itself or raise further triggers without deadlocking.
 */
public final class CallbackSlot {

    private static final Logger logger = LoggerFactory.getLogger(CallbackSlot.class);

    private final Object lock = new Object();
    private final String name;

    private EventCallback callback;
    private Object userData;
    private long pendingCount;

    /**
     * @param name label used in log messages (e.g. "subscription-matched")
     */
    public CallbackSlot(String name) {
        this.name = name;
    }

    /**
     * Replaces the registered callback and user data. Passing {@code null} unregisters the
     * callback; subsequent triggers accumulate again.
     * <p>
     * Pending triggers are replayed synchronously on the calling thread, one invocation per
     * trigger, before this method returns.
     *
     * @param newCallback callback to register, or {@code null}
     * @param newUserData opaque context handed to the callback
     */
    public void set(EventCallback newCallback, Object newUserData) {
        long replay = 0;
        synchronized (lock) {
            callback = newCallback;
            userData = newUserData;
            if (newCallback != null && pendingCount > 0) {
                replay = pendingCount;
                pendingCount = 0;
            }
        }

        if (replay > 0) {
            logger.debug("Replaying {} pending trigger(s) for '{}'", replay, name);
            for (long i = 0; i < replay; i++) {
                invoke(newCallback, newUserData);
            }
        }
    }

    /**
     * Delivers one trigger to the registered callback, or counts it as pending when none is
     * registered.
     */
    public void trigger() {
        EventCallback target;
        Object context;
        synchronized (lock) {
            if (callback == null) {
                pendingCount++;
                return;
            }
            target = callback;
            context = userData;
        }
        invoke(target, context);
    }

    public boolean hasCallback() {
        synchronized (lock) {
            return callback != null;
        }
    }

    public long pendingCount() {
        synchronized (lock) {
            return pendingCount;
        }
    }

    private void invoke(EventCallback target, Object context) {
        try {
            target.onEvent(context, 1);
        } catch (RuntimeException e) {
            logger.error("Event callback for '{}' failed", name, e);
        }
    }

    @Override
    public String toString() {
        return "CallbackSlot[" + name + "]";
    }
}
