package com.contentlib.ingest.pipeline.model;

import java.util.Map;

public record ReaderResponse(
    String content,
    Map<String, String> metadata,
    String provider,
    int creditsUsed
) {
    public String metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }
}
