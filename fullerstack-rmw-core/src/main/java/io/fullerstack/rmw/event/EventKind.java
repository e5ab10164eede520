package io.fullerstack.rmw.event;

import java.util.Objects;

/**
 * Status kinds tracked per entity.
 * <p>
 * The enumeration is dense: {@link #ordinal()} is used directly as the index into the
 * fixed-size per-entity tables held by {@link EventsManager}, so adding a kind means
 * recompiling, never registering at runtime.
 */
public enum EventKind {
    /** Sentinel; never stored in a table. */
    INVALID(Side.NONE),

    // subscription events
    REQUESTED_QOS_INCOMPATIBLE(Side.SUBSCRIPTION),
    MESSAGE_LOST(Side.SUBSCRIPTION),
    SUBSCRIPTION_INCOMPATIBLE_TYPE(Side.SUBSCRIPTION),
    SUBSCRIPTION_MATCHED(Side.SUBSCRIPTION),

    // publisher events
    OFFERED_QOS_INCOMPATIBLE(Side.PUBLISHER),
    PUBLISHER_INCOMPATIBLE_TYPE(Side.PUBLISHER),
    PUBLICATION_MATCHED(Side.PUBLISHER);

    /** Size of the per-entity tables, i.e. highest index + 1. */
    public static final int COUNT = values().length;

    private enum Side { NONE, SUBSCRIPTION, PUBLISHER }

    private final Side side;

    EventKind(Side side) {
        this.side = side;
    }

    public boolean isSubscriptionKind() {
        return side == Side.SUBSCRIPTION;
    }

    public boolean isPublisherKind() {
        return side == Side.PUBLISHER;
    }

    public boolean isValid() {
        return this != INVALID;
    }

    /**
     * Maps a public event type onto the kind that backs it.
     *
     * @param type public event type
     * @return the backing kind, or {@link #INVALID} if this implementation does not support the type
     */
    public static EventKind from(RmwEventType type) {
        Objects.requireNonNull(type, "type cannot be null");
        switch (type) {
            case REQUESTED_QOS_INCOMPATIBLE:
                return REQUESTED_QOS_INCOMPATIBLE;
            case MESSAGE_LOST:
                return MESSAGE_LOST;
            case SUBSCRIPTION_INCOMPATIBLE_TYPE:
                return SUBSCRIPTION_INCOMPATIBLE_TYPE;
            case SUBSCRIPTION_MATCHED:
                return SUBSCRIPTION_MATCHED;
            case OFFERED_QOS_INCOMPATIBLE:
                return OFFERED_QOS_INCOMPATIBLE;
            case PUBLISHER_INCOMPATIBLE_TYPE:
                return PUBLISHER_INCOMPATIBLE_TYPE;
            case PUBLICATION_MATCHED:
                return PUBLICATION_MATCHED;
            default:
                return INVALID;
        }
    }
}
