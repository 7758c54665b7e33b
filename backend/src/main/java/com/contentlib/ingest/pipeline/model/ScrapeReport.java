package com.contentlib.ingest.pipeline.model;

import java.util.List;

public record ScrapeReport(
    List<ScrapedPost> posts,
    int successCount,
    int failureCount,
    CreditInfo credits
) {
}
