package io.fullerstack.rmw.wait;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link WaitSet#waitFor} cycle.
 *
 * @param readyIndices positions (in the list passed to {@code waitFor}) of the waitables that have data
 * @param timedOut     true if nothing became ready before the timeout
 */
public record WaitResult(List<Integer> readyIndices, boolean timedOut) {

    public WaitResult {
        readyIndices = List.copyOf(readyIndices);
    }

    public boolean isReady(int index) {
        return readyIndices.contains(index);
    }

    /**
     * Picks the ready elements out of the list that was waited on.
     *
     * @param waited the same list passed to {@code waitFor}
     * @return the ready elements, in their original order
     */
    public <T> List<T> select(List<T> waited) {
        List<T> ready = new ArrayList<>(readyIndices.size());
        for (int index : readyIndices) {
            ready.add(waited.get(index));
        }
        return ready;
    }
}
