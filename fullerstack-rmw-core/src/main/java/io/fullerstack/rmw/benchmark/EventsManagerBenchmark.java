package io.fullerstack.rmw.benchmark;

import io.fullerstack.rmw.event.EventKind;
import io.fullerstack.rmw.event.EventStatus;
import io.fullerstack.rmw.event.EventsManager;
import io.fullerstack.rmw.wait.WaitSetData;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Hot-path cost of the events manager:
 * <ul>
 *   <li>update with no callback and no attachment</li>
 *   <li>update with a registered callback</li>
 *   <li>update followed by take</li>
 *   <li>one attach/detach poll cycle with nothing pending</li>
 *   <li>contended update from several producer threads</li>
 * </ul>
 *
 * <p>Run with:
 * <pre>
 * mvn clean install && java -cp fullerstack-rmw-core/target/classes:... org.openjdk.jmh.Main EventsManager
 * </pre>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 2)
@Fork(1)
@State(Scope.Benchmark)
public class EventsManagerBenchmark {

    private EventsManager plain;
    private EventsManager withCallback;
    private EventsManager polled;
    private WaitSetData waitSetData;

    @Setup
    public void setup() {
        plain = new EventsManager("bench-plain");
        withCallback = new EventsManager("bench-callback");
        withCallback.setEventCallback(EventKind.SUBSCRIPTION_MATCHED, (userData, count) -> { }, null);
        polled = new EventsManager("bench-polled");
        waitSetData = new WaitSetData();
    }

    @Benchmark
    public void update() {
        plain.updateEventStatus(EventKind.SUBSCRIPTION_MATCHED, 1);
    }

    @Benchmark
    public void updateWithCallback() {
        withCallback.updateEventStatus(EventKind.SUBSCRIPTION_MATCHED, 1);
    }

    @Benchmark
    public void updateThenTake(Blackhole bh) {
        plain.updateEventStatus(EventKind.MESSAGE_LOST, 0);
        EventStatus status = plain.takeEventStatus(EventKind.MESSAGE_LOST);
        bh.consume(status);
    }

    @Benchmark
    public void attachDetachCycle(Blackhole bh) {
        bh.consume(polled.queueHasDataAndAttachConditionIfNot(EventKind.PUBLICATION_MATCHED, waitSetData));
        bh.consume(polled.detachConditionAndEventQueueIsEmpty(EventKind.PUBLICATION_MATCHED));
    }

    @Benchmark
    @Threads(4)
    public void contendedUpdate() {
        plain.updateEventStatus(EventKind.PUBLICATION_MATCHED, 1);
    }
}
