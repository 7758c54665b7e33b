package com.contentlib.ingest.pipeline.model;

import java.time.LocalDate;

public record ScrapedPost(
    String url,
    String title,
    String content,
    LocalDate publishedDate,
    boolean success,
    String error
) {
    public static ScrapedPost failed(String url, String title, String error) {
        return new ScrapedPost(url, title, null, null, false, error);
    }
}
