package com.contentlib.ingest.pipeline.api;

import java.time.LocalDate;
import java.util.List;

public record DiscoverApiRequest(
    String url,
    Integer maxUrls,
    Integer maxPosts,
    LocalDate dateFrom,
    LocalDate dateTo,
    List<String> languages,
    Boolean includeUndetected
) {
}
