package com.vigil.health.reporting;

import com.vigil.health.Subscription;
import com.vigil.health.SubscriptionClosedException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains a {@link Subscription} on a daemon thread and hands each element to a consumer, until the
 * subscription is closed.
 * <p>
 * A failing consumer is logged and skipped; it does not stop the pump.
 *
 * @param <T> element type
 */
public final class SubscriptionPump<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionPump.class);

    private final Subscription<T> subscription;
    private final Consumer<? super T> consumer;
    private final Thread thread;

    /**
     * Creates a pump. Call {@link #start()} to begin draining.
     *
     * @param name         thread name
     * @param subscription the subscription to drain; owned by the pump from now on
     * @param consumer     receives every element, on the pump thread
     */
    public SubscriptionPump(String name, Subscription<T> subscription, Consumer<? super T> consumer) {
        if (subscription == null) {
            throw new IllegalArgumentException("subscription must not be null");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer must not be null");
        }
        this.subscription = subscription;
        this.consumer = consumer;
        this.thread = new Thread(this::pump, name);
        this.thread.setDaemon(true);
    }

    public SubscriptionPump<T> start() {
        thread.start();
        return this;
    }

    public boolean isRunning() {
        return thread.isAlive();
    }

    /**
     * Closes the subscription; the pump ends once the elements already queued are consumed.
     */
    @Override
    public void close() {
        subscription.close();
    }

    private void pump() {
        try {
            while (true) {
                T element = subscription.take();
                try {
                    consumer.accept(element);
                } catch (RuntimeException e) {
                    log.warn("Subscriber failed to handle {} element: {}", subscription.topic(), element, e);
                }
            }
        } catch (SubscriptionClosedException e) {
            log.debug("{} subscription closed, pump '{}' ending", subscription.topic(), thread.getName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
        }
    }
}
