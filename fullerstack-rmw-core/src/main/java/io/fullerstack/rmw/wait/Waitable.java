package io.fullerstack.rmw.wait;

/**
 * Something a {@link WaitSet} can block on: an entity event, a subscription queue or a
 * guard condition.
 * <p>
 * One wait cycle calls {@link #hasDataAndAttachIfNot} once before blocking and
 * {@link #detachAndIsEmpty} once after waking (or after deciding not to block). Detach is only
 * called for waitables whose attach call returned normally.
 */
public interface Waitable {

    /**
     * Atomically checks for pending data and, if there is none, attaches the wait set so the
     * next producer signals it.
     *
     * @param waitSetData wait set to attach
     * @return true if data was already pending (nothing attached), false if attached
     */
    boolean hasDataAndAttachIfNot(WaitSetData waitSetData);

    /**
     * Detaches {@code waitSetData} if it is the attached wait set. An attachment held by a
     * different wait set is left in place.
     *
     * @param waitSetData wait set passed to {@link #hasDataAndAttachIfNot} in the same cycle
     * @return true if nothing is pending, i.e. this waitable did not contribute to the wake
     */
    boolean detachAndIsEmpty(WaitSetData waitSetData);
}
