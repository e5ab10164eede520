package io.fullerstack.rmw.event;

/**
 * Event types exposed by the middleware's public API.
 * <p>
 * Not every type is backed by this implementation; {@link EventKind#from(RmwEventType)}
 * maps the unsupported ones to {@link EventKind#INVALID}.
 */
public enum RmwEventType {
    // subscription events
    LIVELINESS_CHANGED,
    REQUESTED_DEADLINE_MISSED,
    REQUESTED_QOS_INCOMPATIBLE,
    MESSAGE_LOST,
    SUBSCRIPTION_INCOMPATIBLE_TYPE,
    SUBSCRIPTION_MATCHED,

    // publisher events
    LIVELINESS_LOST,
    OFFERED_DEADLINE_MISSED,
    OFFERED_QOS_INCOMPATIBLE,
    PUBLISHER_INCOMPATIBLE_TYPE,
    PUBLICATION_MATCHED,

    INVALID
}
