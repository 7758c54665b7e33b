package com.contentlib.ingest.pipeline.model;

import java.util.List;
import java.util.Map;

public record DiscoveryReport(
    String baseUrl,
    List<DiscoveredUrl> urls,
    String method,
    int creditsUsed,
    int discoveredCount,
    int rejectedByValidation,
    int filteredOut,
    List<String> contentSections,
    List<String> detectedLanguages,
    Map<String, String> errors
) {
}
