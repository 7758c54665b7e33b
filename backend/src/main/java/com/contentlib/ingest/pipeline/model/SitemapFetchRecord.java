package com.contentlib.ingest.pipeline.model;

import java.time.Instant;

public record SitemapFetchRecord(
    String sitemapUrl,
    Instant fetchedAt,
    int urlCount
) {
}
