package io.fullerstack.rmw.entity;

import io.fullerstack.rmw.event.EventKind;

/**
 * Publisher entity. Only publisher-side event kinds are available on it.
 */
public class Publisher extends Entity {

    public Publisher(String topic) {
        super(topic);
    }

    @Override
    protected boolean supports(EventKind kind) {
        return kind.isPublisherKind();
    }
}
