package com.contentlib.ingest.pipeline.model;

import java.util.List;

public record MapResult(
    List<String> links,
    int creditsUsed
) {
}
