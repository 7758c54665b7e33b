package com.contentlib.ingest.pipeline.reader;

public class ReaderException extends RuntimeException {
    private final ReaderErrorCode code;
    private final int httpStatus;
    private final String provider;

    public ReaderException(ReaderErrorCode code, int httpStatus, String provider, String message) {
        super(message);
        this.code = code;
        this.httpStatus = httpStatus;
        this.provider = provider;
    }

    public ReaderException(ReaderErrorCode code, String provider, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.httpStatus = 0;
        this.provider = provider;
    }

    public static ReaderException fromStatus(String provider, int status, String detail) {
        ReaderErrorCode code;
        if (status == 429) {
            code = ReaderErrorCode.RATE_LIMITED;
        } else if (status >= 500) {
            code = ReaderErrorCode.SERVICE_UNAVAILABLE;
        } else if (status == 422) {
            code = ReaderErrorCode.CONTENT_UNAVAILABLE;
        } else if (status == 401) {
            code = ReaderErrorCode.CONFIGURATION;
        } else if (status == 402) {
            code = ReaderErrorCode.CREDITS_EXHAUSTED;
        } else {
            code = ReaderErrorCode.REJECTED;
        }
        String message = provider + " returned http " + status;
        if (detail != null && !detail.isBlank()) {
            message = message + ": " + abbreviate(detail.trim());
        }
        return new ReaderException(code, status, provider, message);
    }

    // A site refusing our fetch is a per-page failure, never a credential problem.
    public static ReaderErrorCode siteStatusCode(int status) {
        if (status == 429) {
            return ReaderErrorCode.RATE_LIMITED;
        }
        if (status >= 500) {
            return ReaderErrorCode.SERVICE_UNAVAILABLE;
        }
        return ReaderErrorCode.CONTENT_UNAVAILABLE;
    }

    public ReaderErrorCode getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    private static String abbreviate(String detail) {
        return detail.length() <= 200 ? detail : detail.substring(0, 200) + "...";
    }
}
