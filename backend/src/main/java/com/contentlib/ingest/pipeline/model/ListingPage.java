package com.contentlib.ingest.pipeline.model;

import java.util.List;

public record ListingPage(
    List<DiscoveredUrl> posts,
    List<String> paginationLinks
) {
}
