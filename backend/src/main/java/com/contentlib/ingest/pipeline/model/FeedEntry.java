package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;

public record FeedEntry(
    String url,
    String title,
    LocalDate publishedDate
) {
}
