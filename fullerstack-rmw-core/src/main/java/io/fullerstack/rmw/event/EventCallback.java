package io.fullerstack.rmw.event;

/**
 * User callback fired when an entity has new data or a status change.
 * <p>
 * Invoked on the thread that raised the event (a transport I/O thread, or the thread
 * registering the callback when pending events are replayed), never while an
 * {@link EventsManager} lock is held, so implementations may call back into the manager.
 */
@FunctionalInterface
public interface EventCallback {

    /**
     * @param userData       the opaque context registered together with the callback
     * @param numberOfEvents number of events this invocation reports
     */
    void onEvent(Object userData, long numberOfEvents);
}
