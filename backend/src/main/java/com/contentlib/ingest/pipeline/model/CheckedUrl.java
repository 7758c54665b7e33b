package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;

public record CheckedUrl(
    String url,
    String title,
    LocalDate publishedDate,
    boolean isDuplicate,
    String existingFingerprintId
) {
    public static CheckedUrl of(DiscoveredUrl candidate, String existingFingerprintId) {
        return new CheckedUrl(
            candidate.url(),
            candidate.title(),
            candidate.publishedDate(),
            existingFingerprintId != null,
            existingFingerprintId
        );
    }
}
