package com.contentlib.ingest.pipeline.model;

import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    List<DiscoveredUrl> urls,
    DiscoveryMethod method,
    int creditsUsed,
    boolean fallbackRequired,
    Map<String, String> errors,
    int filteredOut
) {
    public static DiscoveryResult fallback(int creditsUsed, Map<String, String> errors) {
        return new DiscoveryResult(List.of(), DiscoveryMethod.NONE, creditsUsed, true, errors, 0);
    }
}
