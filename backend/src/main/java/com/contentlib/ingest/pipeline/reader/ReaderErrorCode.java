package com.contentlib.ingest.pipeline.reader;

public enum ReaderErrorCode {
    CONFIGURATION(false),
    RATE_LIMITED(true),
    SERVICE_UNAVAILABLE(true),
    CIRCUIT_OPEN(false),
    CONTENT_UNAVAILABLE(false),
    NETWORK(true),
    TIMEOUT(true),
    CREDITS_EXHAUSTED(false),
    REJECTED(false);

    private final boolean retryable;

    ReaderErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Codes that say something about the health of the provider rather than about one page.
     */
    public boolean countsAgainstProvider() {
        return this == RATE_LIMITED || this == SERVICE_UNAVAILABLE || this == NETWORK || this == TIMEOUT;
    }
}
