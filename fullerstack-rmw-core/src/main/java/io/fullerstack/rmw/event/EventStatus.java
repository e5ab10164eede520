package io.fullerstack.rmw.event;

/**
 * Snapshot of one status kind on one entity, as returned by
 * {@link EventsManager#takeEventStatus(EventKind)}.
 *
 * @param totalCount         all occurrences ever observed
 * @param totalCountChange   occurrences since the previous take
 * @param currentCount       current level of a level-based condition (e.g. matched peers)
 * @param currentCountChange signed change of {@code currentCount} since the previous take
 * @param data               opaque serialized detail for kinds that carry it, may be {@code null}
 * @param changed            whether anything changed since the previous take
 */
public record EventStatus(
    long totalCount,
    long totalCountChange,
    long currentCount,
    int currentCountChange,
    String data,
    boolean changed
) {

    private static final EventStatus EMPTY = new EventStatus(0, 0, 0, 0, null, false);

    public static EventStatus empty() {
        return EMPTY;
    }
}
