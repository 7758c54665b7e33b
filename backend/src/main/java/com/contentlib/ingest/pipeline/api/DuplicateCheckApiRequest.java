package com.contentlib.ingest.pipeline.api;

import com.contentlib.ingest.pipeline.model.DiscoveredUrl;

import java.util.List;

public record DuplicateCheckApiRequest(
    List<DiscoveredUrl> urls,
    String scope
) {
}
