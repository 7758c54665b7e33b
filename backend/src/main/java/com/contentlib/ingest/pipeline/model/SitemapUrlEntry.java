package com.contentlib.ingest.pipeline.model;

public record SitemapUrlEntry(
    String url,
    String lastmod
) {
}
