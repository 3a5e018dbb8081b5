package com.example.tagsync.service.concurrency;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds how many work items run their provider phase at the same time.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ConcurrencyController.Slot slot = controller.acquire()) {
 *     // provider call
 * }
 * }</pre>
 *
 * The semaphore is fair, so waiting tasks are admitted roughly in arrival order.
 */
public class ConcurrencyController {

    private final int maxConcurrent;
    private final Semaphore permits;

    public ConcurrencyController(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, was " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.permits = new Semaphore(maxConcurrent, true);
    }

    /**
     * Blocks until a slot is free. If interrupted while waiting, no slot is held.
     */
    public Slot acquire() throws InterruptedException {
        permits.acquire();
        return new Slot();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int availableSlots() {
        return permits.availablePermits();
    }

    public int inFlight() {
        return maxConcurrent - permits.availablePermits();
    }

    /**
     * A held permit. Closing releases it exactly once.
     */
    public final class Slot implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Slot() {}

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
