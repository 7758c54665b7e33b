package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;

public record DiscoveredUrl(
    String url,
    String title,
    LocalDate publishedDate,
    String contentSection,
    String language
) {
    public DiscoveredUrl withTitleAndDate(String newTitle, LocalDate newDate) {
        return new DiscoveredUrl(
            url,
            newTitle == null || newTitle.isBlank() ? title : newTitle,
            newDate == null ? publishedDate : newDate,
            contentSection,
            language
        );
    }
}
