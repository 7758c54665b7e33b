package com.contentlib.ingest.pipeline.model;

import java.time.Instant;
import java.util.List;

public record ReaderStatus(
    List<Channel> channels,
    CreditInfo credits,
    List<String> suppressedDomains
) {
    public record Channel(
        String provider,
        boolean configured,
        boolean circuitOpen,
        int consecutiveFailures,
        Instant openedAt,
        int inFlight,
        int concurrencyCap,
        long minDelayMs
    ) {
    }
}
