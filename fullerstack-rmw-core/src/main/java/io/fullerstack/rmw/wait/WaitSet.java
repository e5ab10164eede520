package io.fullerstack.rmw.wait;

import io.fullerstack.rmw.config.RmwConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocks one consumer thread until any of a set of {@link Waitable}s has something to report.
 *
 * <h3>Wait cycle</h3>
 * <ol>
 *   <li>Every waitable is polled with {@link Waitable#hasDataAndAttachIfNot}. Waitables with
 *       nothing pending attach this set's {@link WaitSetData}.</li>
 *   <li>If none had data (and the timeout is not zero) the thread blocks on the
 *       {@code WaitSetData} until a producer signals it or the timeout elapses.</li>
 *   <li>Every waitable is then polled with {@link Waitable#detachAndIsEmpty}; the non-empty
 *       ones are reported as ready. A waitable whose attach call threw is not detached, so
 *       an attachment owned by another wait set survives.</li>
 * </ol>
 * Step 3 always runs, on timeout and on interruption too, so no producer is left holding a
 * reference to a wait set that is no longer listening.
 *
 * <p>A wait set serves one consumer at a time.
 */
public final class WaitSet {

    private static final Logger logger = LoggerFactory.getLogger(WaitSet.class);

    private final WaitSetData data = new WaitSetData();
    private final AtomicBoolean waiting = new AtomicBoolean(false);
    private final long slowWaitMs;

    public WaitSet() {
        this(RmwConfig.global().getLong(RmwConfig.SLOW_WAIT_WARN_MS, 1000L));
    }

    /**
     * @param slowWaitMs waits blocking longer than this are logged
     */
    public WaitSet(long slowWaitMs) {
        this.slowWaitMs = slowWaitMs;
    }

    /**
     * Runs one wait cycle.
     *
     * @param waitables the waitables to watch; positions are reported back in the result
     * @param timeout   {@code null} to block until something is ready, {@link Duration#ZERO} to poll
     * @return the ready waitables, or a timed-out result if none became ready
     * @throws InterruptedException  if interrupted while blocked (attachments are released first)
     * @throws IllegalStateException if another thread is already waiting on this set
     */
    public WaitResult waitFor(List<? extends Waitable> waitables, Duration timeout) throws InterruptedException {
        if (waitables == null) {
            throw new IllegalArgumentException("waitables cannot be null");
        }
        for (Waitable waitable : waitables) {
            if (waitable == null) {
                throw new IllegalArgumentException("waitables cannot contain null");
            }
        }
        if (!waiting.compareAndSet(false, true)) {
            throw new IllegalStateException("wait set is already in use by another thread");
        }

        try {
            data.reset();
            boolean skipWait = timeout != null && (timeout.isZero() || timeout.isNegative());

            List<Integer> ready = new ArrayList<>();
            int polled = 0;
            try {
                for (Waitable waitable : waitables) {
                    boolean hasData = waitable.hasDataAndAttachIfNot(data);
                    polled++;
                    if (hasData) {
                        skipWait = true;
                    }
                }

                if (!skipWait) {
                    long start = System.nanoTime();
                    data.await(timeout);
                    long blockedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    if (blockedMs > slowWaitMs) {
                        logger.debug("Wait over {} waitable(s) blocked for {}ms", waitables.size(), blockedMs);
                    }
                }
            } finally {
                for (int i = 0; i < polled; i++) {
                    if (!waitables.get(i).detachAndIsEmpty(data)) {
                        ready.add(i);
                    }
                }
            }

            return new WaitResult(ready, ready.isEmpty());
        } finally {
            waiting.set(false);
        }
    }
}
