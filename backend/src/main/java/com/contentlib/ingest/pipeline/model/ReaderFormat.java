package com.contentlib.ingest.pipeline.model;

public enum ReaderFormat {
    MARKDOWN,
    HTML
}
