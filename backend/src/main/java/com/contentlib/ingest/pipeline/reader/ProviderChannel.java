package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.contentlib.ingest.pipeline.model.ReaderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * A provider behind its own breaker, credit check, retry policy and rate limiter, applied outermost
 * first in that order. A retried call is one breaker outcome; each attempt is paced separately.
 */
public class ProviderChannel {
    private static final Logger log = LoggerFactory.getLogger(ProviderChannel.class);

    private final ReaderProvider provider;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final CreditLedger creditLedger;

    public ProviderChannel(
        ReaderProvider provider,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        RetryPolicy retryPolicy,
        CreditLedger creditLedger
    ) {
        this.provider = provider;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.creditLedger = creditLedger;
    }

    public static ProviderChannel create(
        ReaderProvider provider,
        IngestProperties.Provider providerConfig,
        IngestProperties.Reader readerConfig,
        CreditLedger creditLedger,
        Clock clock,
        Sleeper sleeper
    ) {
        return new ProviderChannel(
            provider,
            new RateLimiter(provider.name(), providerConfig.getMinDelayMs(), providerConfig.getConcurrency(), clock, sleeper),
            new CircuitBreaker(
                provider.name(),
                readerConfig.getBreaker().getThreshold(),
                readerConfig.getBreaker().getCooldownMs(),
                clock
            ),
            new RetryPolicy(readerConfig.getRetry(), sleeper),
            creditLedger
        );
    }

    public ReaderResponse fetch(ReaderRequest request) {
        return execute(request, provider::fetch, ReaderResponse::creditsUsed, provider.creditCost());
    }

    public <T> T execute(ReaderRequest request, Function<ReaderRequest, T> call, ToIntFunction<T> creditsOf, int expectedCost) {
        String name = provider.name();
        if (!provider.isConfigured()) {
            throw new ReaderConfigurationException(name, name + " is not configured");
        }
        circuitBreaker.beforeCall();
        T result;
        try {
            creditLedger.ensureAvailable(name, expectedCost);
            result = retryPolicy.execute(request, attempt -> paced(call, attempt));
        } catch (ReaderException e) {
            if (e.getCode().countsAgainstProvider()) {
                circuitBreaker.recordFailure();
            } else {
                circuitBreaker.releaseTrial();
            }
            throw e;
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure();
            throw new ReaderException(ReaderErrorCode.SERVICE_UNAVAILABLE, name, name + " call failed: " + e.getMessage(), e);
        }
        circuitBreaker.recordSuccess();
        creditLedger.record(name, creditsOf.applyAsInt(result));
        log.debug("reader call ok provider={} url={}", name, request.url());
        return result;
    }

    private <T> T paced(Function<ReaderRequest, T> call, ReaderRequest request) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReaderException(ReaderErrorCode.NETWORK, provider.name(), "interrupted while queued", e);
        }
        try {
            return call.apply(request);
        } finally {
            rateLimiter.release();
        }
    }

    public boolean isConfigured() {
        return provider.isConfigured();
    }

    public String name() {
        return provider.name();
    }

    public ReaderProvider provider() {
        return provider;
    }

    public ReaderStatus.Channel snapshot() {
        return new ReaderStatus.Channel(
            provider.name(),
            provider.isConfigured(),
            circuitBreaker.isOpen(),
            circuitBreaker.consecutiveFailures(),
            circuitBreaker.openedAt(),
            rateLimiter.inFlight(),
            rateLimiter.concurrencyCap(),
            rateLimiter.minDelayMs()
        );
    }
}
