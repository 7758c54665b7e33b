package com.contentlib.ingest.pipeline.reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int threshold;
    private final long cooldownMs;
    private final Clock clock;

    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int threshold, long cooldownMs, Clock clock) {
        this.name = name;
        this.threshold = Math.max(1, threshold);
        this.cooldownMs = Math.max(0, cooldownMs);
        this.clock = clock;
    }

    public synchronized void beforeCall() {
        if (openedAt == null) {
            return;
        }
        long openForMs = clock.millis() - openedAt.toEpochMilli();
        if (openForMs < cooldownMs || trialInFlight) {
            throw new ReaderException(
                ReaderErrorCode.CIRCUIT_OPEN,
                0,
                name,
                name + " circuit open after " + consecutiveFailures + " consecutive failures"
            );
        }
        trialInFlight = true;
        log.info("circuit half-open provider={} openForMs={}", name, openForMs);
    }

    public synchronized void recordSuccess() {
        if (openedAt != null) {
            log.info("circuit closed provider={}", name);
        }
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (trialInFlight) {
            trialInFlight = false;
            openedAt = clock.instant();
            log.warn("circuit re-opened provider={} failures={}", name, consecutiveFailures);
            return;
        }
        if (openedAt == null && consecutiveFailures >= threshold) {
            openedAt = clock.instant();
            log.warn("circuit opened provider={} failures={} cooldownMs={}", name, consecutiveFailures, cooldownMs);
        }
    }

    /**
     * Ends a half-open trial that failed for a reason unrelated to provider health, so the next
     * call may try again.
     */
    public synchronized void releaseTrial() {
        trialInFlight = false;
    }

    public synchronized boolean isOpen() {
        return openedAt != null && (trialInFlight || clock.millis() - openedAt.toEpochMilli() < cooldownMs);
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant openedAt() {
        return openedAt;
    }
}
