package com.contentlib.ingest.pipeline.reader;

public class ReaderConfigurationException extends ReaderException {
    public ReaderConfigurationException(String provider, String message) {
        super(ReaderErrorCode.CONFIGURATION, 0, provider, message);
    }
}
