package io.fullerstack.rmw.wait;

/**
 * A manually triggered {@link Waitable}, used to wake a wait set from application code
 * (shutdown requests, graph changes, ...).
 * <p>
 * A trigger is consumed by the wait cycle that observes it: {@link #detachAndIsEmpty}
 * clears the flag.
 */
public final class GuardCondition implements Waitable {

    private final Object lock = new Object();
    private boolean triggered;
    private WaitSetData attached;

    /**
     * Sets the trigger and wakes the attached wait set, if any.
     */
    public void trigger() {
        synchronized (lock) {
            triggered = true;
            if (attached != null) {
                attached.signal();
                attached = null;
            }
        }
    }

    public boolean isTriggered() {
        synchronized (lock) {
            return triggered;
        }
    }

    @Override
    public boolean hasDataAndAttachIfNot(WaitSetData waitSetData) {
        synchronized (lock) {
            if (triggered) {
                return true;
            }
            if (attached != null && attached != waitSetData) {
                throw new IllegalStateException("guard condition is already attached to another wait set");
            }
            attached = waitSetData;
            return false;
        }
    }

    @Override
    public boolean detachAndIsEmpty(WaitSetData waitSetData) {
        synchronized (lock) {
            if (attached == waitSetData) {
                attached = null;
            }
            boolean wasTriggered = triggered;
            triggered = false;
            return !wasTriggered;
        }
    }
}
