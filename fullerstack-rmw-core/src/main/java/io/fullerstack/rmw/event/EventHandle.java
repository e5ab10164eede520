package io.fullerstack.rmw.event;

import io.fullerstack.rmw.wait.WaitSetData;
import io.fullerstack.rmw.wait.Waitable;

import java.util.Objects;

/**
 * One event kind of one entity, as handed out to the application.
 * <p>
 * A handle can be taken from, given a callback, or placed in a {@link io.fullerstack.rmw.wait.WaitSet}.
 */
public final class EventHandle implements Waitable {

    private final EventsManager events;
    private final EventKind kind;

    public EventHandle(EventsManager events, EventKind kind) {
        this.events = Objects.requireNonNull(events, "events cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        if (!kind.isValid()) {
            throw new IllegalArgumentException("kind cannot be INVALID");
        }
    }

    public EventKind kind() {
        return kind;
    }

    /**
     * @return the current status; its change counters are reset by this call
     */
    public EventStatus take() {
        return events.takeEventStatus(kind);
    }

    public void setCallback(EventCallback callback, Object userData) {
        events.setEventCallback(kind, callback, userData);
    }

    @Override
    public boolean hasDataAndAttachIfNot(WaitSetData waitSetData) {
        return events.queueHasDataAndAttachConditionIfNot(kind, waitSetData);
    }

    @Override
    public boolean detachAndIsEmpty(WaitSetData waitSetData) {
        return events.detachConditionAndEventQueueIsEmpty(kind, waitSetData);
    }

    @Override
    public String toString() {
        return "EventHandle[" + events.owner() + "/" + kind + "]";
    }
}
