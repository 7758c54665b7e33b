package com.contentlib.ingest.pipeline.extract;

@FunctionalInterface
public interface ScrapeProgressListener {
    ScrapeProgressListener NONE = (done, total) -> {
    };

    void onProgress(int done, int total);
}
