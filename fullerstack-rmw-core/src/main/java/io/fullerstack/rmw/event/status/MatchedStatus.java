package io.fullerstack.rmw.event.status;

import io.fullerstack.rmw.event.EventStatus;

/**
 * Publication/subscription matched status.
 */
public record MatchedStatus(
    long totalCount,
    long totalCountChange,
    long currentCount,
    int currentCountChange
) {

    public static MatchedStatus from(EventStatus status) {
        return new MatchedStatus(
            status.totalCount(),
            status.totalCountChange(),
            status.currentCount(),
            status.currentCountChange()
        );
    }
}
