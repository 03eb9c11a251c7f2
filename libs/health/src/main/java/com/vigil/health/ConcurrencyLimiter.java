package com.vigil.health;

import java.util.concurrent.Semaphore;

/**
 * Counting semaphore bounding how many scheduled checks run at the same time across the engine.
 */
final class ConcurrencyLimiter {

    private final int maxPermits;
    private final Semaphore permits;

    ConcurrencyLimiter(int maxPermits) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("maxPermits must be at least 1");
        }
        this.maxPermits = maxPermits;
        this.permits = new Semaphore(maxPermits, true);
    }

    void acquire() throws InterruptedException {
        permits.acquire();
    }

    void release() {
        permits.release();
    }

    int maxPermits() {
        return maxPermits;
    }

    int inUse() {
        return maxPermits - permits.availablePermits();
    }
}
