package com.contentlib.ingest.pipeline.reader;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

public class RateLimiter {
    static final long POLL_INTERVAL_MS = 100;

    private final String name;
    private final long minDelayMs;
    private final int concurrencyCap;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock queue = new ReentrantLock(true);
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile long lastStartMillis = Long.MIN_VALUE;

    public RateLimiter(String name, long minDelayMs, int concurrencyCap, Clock clock, Sleeper sleeper) {
        this.name = name;
        this.minDelayMs = Math.max(0, minDelayMs);
        this.concurrencyCap = Math.max(1, concurrencyCap);
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until this caller is at the head of the queue, a slot is free and the spacing since
     * the previous admission has elapsed. Every successful acquire must be paired with
     * {@link #release()}.
     */
    public void acquire() throws InterruptedException {
        queue.lockInterruptibly();
        try {
            while (inFlight.get() >= concurrencyCap) {
                sleeper.sleep(POLL_INTERVAL_MS);
            }
            if (lastStartMillis != Long.MIN_VALUE) {
                long waitMs = minDelayMs - (clock.millis() - lastStartMillis);
                if (waitMs > 0) {
                    sleeper.sleep(waitMs);
                }
            }
            lastStartMillis = clock.millis();
            inFlight.incrementAndGet();
        } finally {
            queue.unlock();
        }
    }

    public void release() {
        inFlight.updateAndGet(current -> Math.max(0, current - 1));
    }

    public String name() {
        return name;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int concurrencyCap() {
        return concurrencyCap;
    }

    public long minDelayMs() {
        return minDelayMs;
    }
}
