package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;

/**
 * One external content reader. Implementations perform a single attempt and report failures as
 * {@link ReaderException}; pacing, retries and the breaker are applied by {@link ProviderChannel}.
 */
public interface ReaderProvider {
    String name();

    boolean isConfigured();

    /**
     * Credits one successful fetch is expected to cost, checked against the ledger before I/O.
     */
    int creditCost();

    ReaderResponse fetch(ReaderRequest request);
}
