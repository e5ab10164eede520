package io.fullerstack.rmw.event.status;

import io.fullerstack.rmw.event.EventStatus;

public record IncompatibleTypeStatus(long totalCount, long totalCountChange) {

    public static IncompatibleTypeStatus from(EventStatus status) {
        return new IncompatibleTypeStatus(status.totalCount(), status.totalCountChange());
    }
}
