package io.fullerstack.rmw.wait;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The blocking primitive a consumer waits on across many entities at once.
 * <p>
 * Producers never own a {@code WaitSetData}; they hold a reference to it only while it is
 * attached to one of their (entity, kind) slots, and {@link #signal()} it when that slot
 * receives something. The {@code triggered} flag makes a signal that arrives before the
 * consumer starts blocking visible to {@link #await(Duration)}.
 * <p>
 * Uses the monitor wait/notify idiom rather than polling: the waiting thread parks until
 * signaled or until its deadline passes.
 */
public final class WaitSetData {

    private final Object monitor = new Object();
    private boolean triggered;

    /**
     * Marks this wait set as triggered and wakes every thread blocked in {@link #await}.
     */
    public void signal() {
        synchronized (monitor) {
            triggered = true;
            monitor.notifyAll();
        }
    }

    /**
     * Blocks until {@link #signal()} is called or the timeout elapses.
     *
     * @param timeout maximum time to block, {@code null} (or a duration too long to express in
     *                nanoseconds) to block indefinitely
     * @return true if signaled, false if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        synchronized (monitor) {
            if (timeout == null) {
                while (!triggered) {
                    monitor.wait();
                }
                return true;
            }

            long remaining = toNanosSaturated(timeout);
            if (remaining == Long.MAX_VALUE) {
                while (!triggered) {
                    monitor.wait();
                }
                return true;
            }

            long deadline = System.nanoTime() + remaining;
            while (!triggered && remaining > 0) {
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
                remaining = deadline - System.nanoTime();
            }
            return triggered;
        }
    }

    // Durations beyond Long.MAX_VALUE nanoseconds (~292 years) are treated as unbounded.
    private static long toNanosSaturated(Duration timeout) {
        if (timeout.isNegative()) {
            return 0;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    public boolean isTriggered() {
        synchronized (monitor) {
            return triggered;
        }
    }

    /**
     * Clears the triggered flag so the next wait cycle starts fresh.
     */
    public void reset() {
        synchronized (monitor) {
            triggered = false;
        }
    }
}
