package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void contentUnavailableWithProxyRetriesOnceWithoutProxy() {
        List<Long> sleeps = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(3, 1000, 60_000, sleeps::add);
        List<Boolean> proxyFlags = new ArrayList<>();

        String result = policy.execute(
            new ReaderRequest("https://example.com/a", ReaderFormat.MARKDOWN, true),
            request -> {
                proxyFlags.add(request.useLocationProxy());
                if (request.useLocationProxy()) {
                    throw new ReaderException(ReaderErrorCode.CONTENT_UNAVAILABLE, 422, "firecrawl", "unprocessable");
                }
                return "ok";
            }
        );

        assertThat(result).isEqualTo("ok");
        assertThat(proxyFlags).containsExactly(true, false);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void contentUnavailableWithoutProxyIsNotRetried() {
        List<Boolean> proxyFlags = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(3, 1000, 60_000, ms -> { });

        assertThatThrownBy(() -> policy.execute(
            new ReaderRequest("https://example.com/a", ReaderFormat.MARKDOWN, false),
            request -> {
                proxyFlags.add(request.useLocationProxy());
                throw new ReaderException(ReaderErrorCode.CONTENT_UNAVAILABLE, 422, "firecrawl", "unprocessable");
            }
        )).isInstanceOf(ReaderException.class);
        assertThat(proxyFlags).hasSize(1);
    }

    @Test
    void serviceUnavailableBacksOffExponentiallyAndStopsAtMaxAttempts() {
        List<Long> sleeps = new ArrayList<>();
        RetryPolicy policy = new RetryPolicy(3, 1000, 60_000, sleeps::add);
        int[] calls = new int[1];

        assertThatThrownBy(() -> policy.execute(
            new ReaderRequest("https://example.com/a", ReaderFormat.MARKDOWN, false),
            request -> {
                calls[0]++;
                throw new ReaderException(ReaderErrorCode.SERVICE_UNAVAILABLE, 503, "jina", "unavailable");
            }
        )).isInstanceOfSatisfying(ReaderException.class,
            e -> assertThat(e.getHttpStatus()).isEqualTo(503));

        assertThat(calls[0]).isEqualTo(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    void rateLimitedBacksOffLinearly() {
        RetryPolicy policy = new RetryPolicy(4, 1000, 60_000, ms -> { });
        assertThat(policy.delayFor(ReaderErrorCode.RATE_LIMITED, 1)).isEqualTo(1000);
        assertThat(policy.delayFor(ReaderErrorCode.RATE_LIMITED, 3)).isEqualTo(3000);
        assertThat(policy.delayFor(ReaderErrorCode.SERVICE_UNAVAILABLE, 4)).isEqualTo(8000);
    }

    @Test
    void delayIsCappedAtMax() {
        RetryPolicy policy = new RetryPolicy(10, 1000, 5000, ms -> { });
        assertThat(policy.delayFor(ReaderErrorCode.SERVICE_UNAVAILABLE, 9)).isEqualTo(5000);
        assertThat(policy.delayFor(ReaderErrorCode.TIMEOUT, 9)).isEqualTo(5000);
    }

    @Test
    void nonRetryableErrorsFailImmediately() {
        int[] calls = new int[1];
        RetryPolicy policy = new RetryPolicy(3, 1000, 60_000, ms -> { });

        assertThatThrownBy(() -> policy.execute(
            new ReaderRequest("https://example.com/a", ReaderFormat.HTML, false),
            request -> {
                calls[0]++;
                throw ReaderException.fromStatus("jina", 404, "not found");
            }
        )).isInstanceOfSatisfying(ReaderException.class,
            e -> assertThat(e.getCode()).isEqualTo(ReaderErrorCode.REJECTED));
        assertThat(calls[0]).isEqualTo(1);
    }
}
