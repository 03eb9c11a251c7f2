package com.vigil.health;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A subscriber-owned stream of engine events (registrations, results or overall-health changes).
 * <p>
 * The engine appends to an unbounded queue and never blocks on delivery, so a subscriber that does
 * not keep up only grows its own backlog. Elements delivered before {@link #close()} can still be
 * consumed; once the queue is drained, {@link #take()} throws {@link SubscriptionClosedException}.
 * <p>
 * All subscriptions are closed when the engine shuts down.
 *
 * @param <T> element type
 */
public final class Subscription<T> implements AutoCloseable {

    private final String topic;
    // an empty element marks the end of the stream
    private final LinkedBlockingQueue<Optional<T>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Consumer<Subscription<T>> onClose;

    Subscription(String topic, Consumer<Subscription<T>> onClose) {
        this.topic = topic;
        this.onClose = onClose;
    }

    /**
     * Waits for the next element.
     *
     * @throws SubscriptionClosedException if the subscription is closed and fully drained
     * @throws InterruptedException        if interrupted while waiting
     */
    public T take() throws InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Waits up to {@code timeout} for the next element.
     *
     * @return the next element, or empty if none arrived in time
     * @throws SubscriptionClosedException if the subscription is closed and fully drained
     * @throws InterruptedException        if interrupted while waiting
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        Optional<T> next = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return next == null ? Optional.empty() : Optional.of(unwrap(next));
    }

    /**
     * Removes and returns every element currently queued, without waiting.
     */
    public List<T> drain() {
        List<Optional<T>> drained = new ArrayList<>();
        queue.drainTo(drained);
        List<T> elements = new ArrayList<>(drained.size());
        for (Optional<T> element : drained) {
            if (element.isPresent()) {
                elements.add(element.get());
            } else {
                queue.offer(element);
            }
        }
        return elements;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Name of the event stream this subscription is attached to. */
    public String topic() {
        return topic;
    }

    /**
     * Unsubscribes. Idempotent.
     */
    @Override
    public void close() {
        if (markClosed()) {
            onClose.accept(this);
        }
    }

    /**
     * Queues an element unless the subscription is closed. Never blocks.
     */
    boolean deliver(T element) {
        if (closed.get()) {
            return false;
        }
        return queue.offer(Optional.of(element));
    }

    /**
     * Closes the subscription on behalf of the engine, without calling back into it.
     */
    boolean markClosed() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(Optional.empty());
            return true;
        }
        return false;
    }

    private T unwrap(Optional<T> next) {
        if (next.isEmpty()) {
            // leave the marker for the next caller
            queue.offer(next);
            throw new SubscriptionClosedException();
        }
        return next.get();
    }

    @Override
    public String toString() {
        return "Subscription{topic=" + topic + ", closed=" + closed.get() + "}";
    }
}
