package com.contentlib.ingest.pipeline.api;

import com.contentlib.ingest.pipeline.reader.ReaderConfigurationException;
import com.contentlib.ingest.pipeline.reader.ReaderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
public class ImportExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ImportExceptionHandler.class);

    @ExceptionHandler(ReaderConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleNotConfigured(ReaderConfigurationException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "reader_not_configured", "message", ex.getMessage()));
    }

    @ExceptionHandler(ReaderException.class)
    public ResponseEntity<Map<String, String>> handleReaderFailure(ReaderException ex) {
        log.warn("reader request failed provider={} code={} status={}", ex.getProvider(), ex.getCode(), ex.getHttpStatus());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("error", ex.getCode().name().toLowerCase(Locale.ROOT), "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadInput(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
    }
}
