package com.contentlib.ingest.pipeline.reader;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(long millis) throws InterruptedException;
}
