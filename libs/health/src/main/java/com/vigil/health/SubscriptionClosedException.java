package com.vigil.health;

/**
 * Thrown when waiting on a {@link Subscription} that has been closed and has no pending elements.
 */
public class SubscriptionClosedException extends IllegalStateException {

    public SubscriptionClosedException() {
        super("subscription is closed");
    }
}
