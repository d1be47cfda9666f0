package com.workoutapi.refresh.client;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps how many refresh operations run their gated section at the same time.
 * Slots are handed out as {@link Slot} so callers return them with
 * try-with-resources on every exit path.
 */
public class ConcurrencyLimiter {

    private final int maxConcurrency;
    private final Semaphore slots;

    public ConcurrencyLimiter(int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.slots = new Semaphore(maxConcurrency, true);
    }

    /**
     * Blocks until a slot is free.
     */
    public Slot acquire() throws InterruptedException {
        slots.acquire();
        return new Slot();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public final class Slot implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Slot() {
        }

        /**
         * Returns the slot. Repeated calls are no-ops.
         */
        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
