package com.contentlib.ingest.pipeline.model;

public record ReaderRequest(
    String url,
    ReaderFormat format,
    boolean useLocationProxy
) {
    public ReaderRequest withoutLocationProxy() {
        return new ReaderRequest(url, format, false);
    }
}
