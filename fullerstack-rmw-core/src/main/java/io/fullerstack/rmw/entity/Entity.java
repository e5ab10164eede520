package io.fullerstack.rmw.entity;

import io.fullerstack.rmw.event.EventHandle;
import io.fullerstack.rmw.event.EventKind;
import io.fullerstack.rmw.event.EventsManager;
import io.fullerstack.rmw.event.RmwEventType;

import java.util.Objects;
import java.util.Optional;

/**
 * Base for publishers and subscriptions: an entity owns exactly one {@link EventsManager},
 * created with the entity and discarded with it.
 */
public abstract class Entity {

    private final String name;
    private final EventsManager events;

    protected Entity(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        this.events = new EventsManager(name);
    }

    public String name() {
        return name;
    }

    /**
     * Transport-facing side of the entity's status bookkeeping.
     */
    public EventsManager events() {
        return events;
    }

    /**
     * Returns a handle on one event type of this entity.
     *
     * @param type public event type
     * @return the handle, or empty if this implementation or this kind of entity does not support the type
     */
    public Optional<EventHandle> eventHandle(RmwEventType type) {
        EventKind kind = EventKind.from(type);
        if (!kind.isValid() || !supports(kind)) {
            return Optional.empty();
        }
        return Optional.of(new EventHandle(events, kind));
    }

    /**
     * @return whether {@code kind} belongs to this side of the connection
     */
    protected abstract boolean supports(EventKind kind);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
