package io.fullerstack.rmw.event;

import io.fullerstack.rmw.wait.WaitSetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Per-entity status bookkeeping for every {@link EventKind}: one status counter, one
 * {@link CallbackSlot} and one wait-set attachment per kind, held in arrays indexed by
 * {@link EventKind#ordinal()}.
 *
 * <h3>Locking</h3>
 * <ul>
 *   <li><b>attachment lock</b> guards the attachment slots and the signal-and-clear step;
 *       it is always taken <em>before</em> the status lock</li>
 *   <li><b>status lock</b> guards the counters</li>
 *   <li>callbacks run with neither lock held</li>
 * </ul>
 * {@link #queueHasDataAndAttachConditionIfNot} holds the attachment lock across its check and
 * its attach, and {@link #updateEventStatus} mutates the counters before it takes the
 * attachment lock to signal. An update therefore either lands before the check (the check
 * sees {@code changed}) or signals the attachment the check installed. No wakeup is lost.
 *
 * <p>None of the operations block; each one is a short, constant-time critical section.
 */
public final class EventsManager {

    private static final Logger logger = LoggerFactory.getLogger(EventsManager.class);

    private final String owner;

    private final Object attachmentLock = new Object();
    private final Object statusLock = new Object();

    private final WaitSetData[] attachments = new WaitSetData[EventKind.COUNT];
    private final CallbackSlot[] callbacks = new CallbackSlot[EventKind.COUNT];
    private final StatusCounter[] statuses = new StatusCounter[EventKind.COUNT];

    /**
     * @param owner name of the owning entity, used in log messages
     */
    public EventsManager(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner cannot be null");
        for (EventKind kind : EventKind.values()) {
            callbacks[kind.ordinal()] = new CallbackSlot(owner + "/" + kind);
            statuses[kind.ordinal()] = new StatusCounter();
        }
    }

    /**
     * Sets the callback triggered whenever {@code kind} changes. Changes raised while no
     * callback was set are replayed to the new callback before this method returns.
     *
     * @param kind     the event kind
     * @param callback the callback, or {@code null} to unregister
     * @param userData data passed to the callback
     */
    public void setEventCallback(EventKind kind, EventCallback callback, Object userData) {
        callbacks[indexOf(kind)].set(callback, userData);
    }

    /**
     * Returns the status of {@code kind} and resets its change counters.
     *
     * @param kind the event kind
     * @return the status as it was before the reset
     */
    public EventStatus takeEventStatus(EventKind kind) {
        int index = indexOf(kind);
        synchronized (statusLock) {
            return statuses[index].snapshotAndReset();
        }
    }

    /**
     * Records one occurrence of {@code kind}.
     *
     * @param kind               the event kind
     * @param currentCountChange change of the level-based count (e.g. +1 matched, -1 unmatched)
     */
    public void updateEventStatus(EventKind kind, int currentCountChange) {
        updateEventStatus(kind, currentCountChange, null);
    }

    /**
     * Records one occurrence of {@code kind} together with an opaque payload.
     *
     * @param kind               the event kind
     * @param currentCountChange change of the level-based count
     * @param data               serialized detail stored in {@link EventStatus#data()}; {@code null} keeps the previous payload
     */
    public void updateEventStatus(EventKind kind, int currentCountChange, String data) {
        int index = indexOf(kind);
        boolean inRange;
        synchronized (statusLock) {
            inRange = statuses[index].apply(currentCountChange, data);
        }
        if (!inRange) {
            logger.warn("{}: current count for {} would drop below zero (change {}), clamped at 0",
                owner, kind, currentCountChange);
        }

        callbacks[index].trigger();
        notifyAttached(index);
    }

    /**
     * Attaches {@code waitSetData} to {@code kind} unless a status change is already pending.
     *
     * @param kind        the event kind
     * @param waitSetData wait set to signal on the next update
     * @return true if a change is pending (nothing attached), false if attached
     * @throws IllegalStateException if a different wait set is still attached to {@code kind}
     */
    public boolean queueHasDataAndAttachConditionIfNot(EventKind kind, WaitSetData waitSetData) {
        int index = indexOf(kind);
        Objects.requireNonNull(waitSetData, "waitSetData cannot be null");

        synchronized (attachmentLock) {
            synchronized (statusLock) {
                if (statuses[index].changed) {
                    return true;
                }
            }

            WaitSetData attached = attachments[index];
            if (attached != null && attached != waitSetData) {
                throw new IllegalStateException(
                    owner + ": another wait set is already attached to " + kind
                );
            }
            attachments[index] = waitSetData;
            return false;
        }
    }

    /**
     * Detaches whatever wait set is attached to {@code kind}. Safe when nothing is attached.
     *
     * @param kind the event kind
     * @return true if no unread status change is pending for {@code kind}
     */
    public boolean detachConditionAndEventQueueIsEmpty(EventKind kind) {
        int index = indexOf(kind);
        synchronized (attachmentLock) {
            attachments[index] = null;
        }
        synchronized (statusLock) {
            return !statuses[index].changed;
        }
    }

    /**
     * Detaches {@code waitSetData} from {@code kind} if it is the attached wait set. Another
     * wait set's attachment is left in place so its next signal is not lost.
     *
     * @param kind        the event kind
     * @param waitSetData wait set that attached itself in the current wait cycle
     * @return true if no unread status change is pending for {@code kind}
     */
    public boolean detachConditionAndEventQueueIsEmpty(EventKind kind, WaitSetData waitSetData) {
        int index = indexOf(kind);
        Objects.requireNonNull(waitSetData, "waitSetData cannot be null");
        synchronized (attachmentLock) {
            if (attachments[index] == waitSetData) {
                attachments[index] = null;
            }
        }
        synchronized (statusLock) {
            return !statuses[index].changed;
        }
    }

    public boolean isAttached(EventKind kind) {
        int index = indexOf(kind);
        synchronized (attachmentLock) {
            return attachments[index] != null;
        }
    }

    public String owner() {
        return owner;
    }

    // Signals are one-shot: the attachment is cleared together with the signal.
    private void notifyAttached(int index) {
        synchronized (attachmentLock) {
            WaitSetData attached = attachments[index];
            if (attached != null) {
                attached.signal();
                attachments[index] = null;
            }
        }
    }

    private static int indexOf(EventKind kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (!kind.isValid()) {
            throw new IllegalArgumentException("kind cannot be INVALID");
        }
        return kind.ordinal();
    }

    @Override
    public String toString() {
        return "EventsManager[" + owner + "]";
    }

    /** Mutable counters for one kind. Guarded by {@code statusLock}. */
    private static final class StatusCounter {
        private long totalCount;
        private long totalCountChange;
        private long currentCount;
        private int currentCountChange;
        private String data;
        private boolean changed;

        /** @return false if the current count had to be clamped */
        boolean apply(int delta, String payload) {
            totalCount++;
            totalCountChange++;
            currentCountChange += delta;
            if (payload != null) {
                data = payload;
            }
            changed = true;

            long next = currentCount + delta;
            if (next < 0) {
                currentCount = 0;
                return false;
            }
            currentCount = next;
            return true;
        }

        EventStatus snapshotAndReset() {
            EventStatus snapshot = new EventStatus(
                totalCount, totalCountChange, currentCount, currentCountChange, data, changed
            );
            totalCountChange = 0;
            currentCountChange = 0;
            changed = false;
            return snapshot;
        }
    }
}
