package com.contentlib.ingest.pipeline.model;

public record ExistingFingerprint(
    String id,
    String scope,
    String sourceUrl
) {
}
