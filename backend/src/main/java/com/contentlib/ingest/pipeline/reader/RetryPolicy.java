package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    public RetryPolicy(IngestProperties.Retry retry, Sleeper sleeper) {
        this(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), sleeper);
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.sleeper = sleeper;
    }

    public <T> T execute(ReaderRequest request, Function<ReaderRequest, T> call) {
        ReaderRequest current = request;
        boolean proxyDropped = false;
        int attempt = 1;
        while (true) {
            try {
                return call.apply(current);
            } catch (ReaderException e) {
                if (e.getCode() == ReaderErrorCode.CONTENT_UNAVAILABLE && current.useLocationProxy() && !proxyDropped) {
                    log.info("retrying without location proxy provider={} url={}", e.getProvider(), current.url());
                    current = current.withoutLocationProxy();
                    proxyDropped = true;
                    continue;
                }
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                long delayMs = delayFor(e.getCode(), attempt);
                log.debug(
                    "reader retry provider={} code={} attempt={} delayMs={}",
                    e.getProvider(),
                    e.getCode(),
                    attempt,
                    delayMs
                );
                pause(delayMs, e);
                attempt++;
            }
        }
    }

    long delayFor(ReaderErrorCode code, int attempt) {
        long delay;
        if (code == ReaderErrorCode.SERVICE_UNAVAILABLE) {
            int shift = Math.min(30, Math.max(0, attempt - 1));
            delay = baseDelayMs * (1L << shift);
        } else {
            delay = baseDelayMs * attempt;
        }
        return Math.min(maxDelayMs, delay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(long delayMs, ReaderException cause) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
