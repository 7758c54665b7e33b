package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;
import java.util.List;

public record DiscoveryOptions(
    int maxUrls,
    Integer maxPosts,
    LocalDate dateFrom,
    LocalDate dateTo,
    List<String> languages,
    boolean includeUndetected
) {
    public static DiscoveryOptions defaults(int maxUrls) {
        return new DiscoveryOptions(maxUrls, null, null, null, List.of(), true);
    }
}
