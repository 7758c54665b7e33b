package com.contentlib.ingest.pipeline.model;

public record CreditInfo(
    int used,
    int limit,
    int warningThreshold
) {
    public int remaining() {
        return Math.max(0, limit - used);
    }
}
