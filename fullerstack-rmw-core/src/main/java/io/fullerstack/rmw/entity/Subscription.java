package io.fullerstack.rmw.entity;

import io.fullerstack.rmw.config.RmwConfig;
import io.fullerstack.rmw.event.DataCallbackManager;
import io.fullerstack.rmw.event.EventCallback;
import io.fullerstack.rmw.event.EventKind;
import io.fullerstack.rmw.wait.WaitSetData;
import io.fullerstack.rmw.wait.Waitable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Subscription entity with a KEEP_LAST message queue.
 * <p>
 * Transport threads hand messages to {@link #deliver(Object)}; the consumer takes them with
 * {@link #take()}, either after a {@link io.fullerstack.rmw.wait.WaitSet} reports this
 * subscription ready or from the new-message callback. When the queue is full the oldest
 * message is discarded.
 *
 * @param <T> message type
 */
public class Subscription<T> extends Entity implements Waitable {

    private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

    private final int depth;
    private final Deque<T> queue;
    private final DataCallbackManager dataCallbacks;

    private final Object queueLock = new Object();
    private WaitSetData attached;

    /**
     * Creates a subscription with the configured default depth ({@value RmwConfig#SUBSCRIPTION_QUEUE_DEPTH}).
     */
    public Subscription(String topic) {
        this(topic, RmwConfig.global().getInt(RmwConfig.SUBSCRIPTION_QUEUE_DEPTH, 10));
    }

    public Subscription(String topic, int depth) {
        super(topic);
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be positive");
        }
        this.depth = depth;
        this.queue = new ArrayDeque<>(depth);
        this.dataCallbacks = new DataCallbackManager(topic + "/new-message");
    }

    /**
     * Adds a received message, discarding the oldest one if the queue is at depth, then fires
     * the new-message callback and wakes an attached wait set.
     *
     * @param message the received message
     */
    public void deliver(T message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }

        synchronized (queueLock) {
            if (queue.size() >= depth) {
                queue.pollFirst();
                logger.debug("{}: message queue depth of {} reached, discarding oldest message", name(), depth);
            }
            queue.addLast(message);
        }

        dataCallbacks.triggerCallback();

        synchronized (queueLock) {
            if (attached != null) {
                attached.signal();
                attached = null;
            }
        }
    }

    /**
     * @return the oldest queued message, or empty if the queue is empty
     */
    public Optional<T> take() {
        synchronized (queueLock) {
            return Optional.ofNullable(queue.pollFirst());
        }
    }

    public int queued() {
        synchronized (queueLock) {
            return queue.size();
        }
    }

    public int depth() {
        return depth;
    }

    /**
     * Sets the callback fired once per received message. Messages received before a callback
     * was set are reported to it immediately.
     */
    public void setOnNewMessageCallback(EventCallback callback, Object userData) {
        dataCallbacks.setCallback(callback, userData);
    }

    @Override
    public boolean hasDataAndAttachIfNot(WaitSetData waitSetData) {
        synchronized (queueLock) {
            if (!queue.isEmpty()) {
                return true;
            }
            if (attached != null && attached != waitSetData) {
                throw new IllegalStateException(name() + ": another wait set is already attached");
            }
            attached = waitSetData;
            return false;
        }
    }

    @Override
    public boolean detachAndIsEmpty(WaitSetData waitSetData) {
        synchronized (queueLock) {
            if (attached == waitSetData) {
                attached = null;
            }
            return queue.isEmpty();
        }
    }

    @Override
    protected boolean supports(EventKind kind) {
        return kind.isSubscriptionKind();
    }
}
