package io.fullerstack.rmw.event.status;

import io.fullerstack.rmw.event.EventStatus;

public record MessageLostStatus(long totalCount, long totalCountChange) {

    public static MessageLostStatus from(EventStatus status) {
        return new MessageLostStatus(status.totalCount(), status.totalCountChange());
    }
}
