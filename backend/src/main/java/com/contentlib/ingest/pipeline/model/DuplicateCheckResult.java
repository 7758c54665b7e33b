package com.contentlib.ingest.pipeline.model;

import java.util.List;

public record DuplicateCheckResult(
    List<CheckedUrl> all,
    List<CheckedUrl> newUrls,
    List<CheckedUrl> duplicates,
    Stats stats
) {
    public record Stats(int total, int newCount, int duplicateCount) {
    }
}
