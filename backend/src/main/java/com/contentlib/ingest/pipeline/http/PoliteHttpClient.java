package com.contentlib.ingest.pipeline.http;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PoliteHttpClient {
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_BYTES = 5_000_000;

    private final IngestProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Semaphore> hostLimiters = new ConcurrentHashMap<>();
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();
    private final DomainFailureTracker domainFailureTracker;

    public PoliteHttpClient(
        IngestProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        DomainFailureTracker domainFailureTracker
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
        this.domainFailureTracker = domainFailureTracker;
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, DEFAULT_MAX_BYTES);
    }

    public HttpFetchResult get(String url, String acceptHeader, int maxBytes) {
        return send(url, acceptHeader, maxBytes, Profile.POLITE);
    }

    /**
     * Unauthenticated fetch with browser-like headers. Domains that keep blocking us are suppressed
     * without any network I/O once they cross the configured failure threshold.
     */
    public HttpFetchResult fetchAsBrowser(String url) {
        URI uri = normalizeUri(url);
        String host = uri == null ? null : uri.getHost();
        if (host != null && domainFailureTracker.isSuppressed(host)) {
            return errorResult(
                url,
                Instant.now(),
                "domain_suppressed",
                "failures=" + domainFailureTracker.failureCount(host)
            );
        }
        HttpFetchResult result = send(url, HTML_ACCEPT, properties.getFallback().getMaxBytes(), Profile.BROWSER);
        recordDomainOutcome(host, result);
        return result;
    }

    private HttpFetchResult send(String url, String acceptHeader, int maxBytes, Profile profile) {
        int maxAttempts = profile == Profile.BROWSER ? 1 : 1 + properties.getRequestMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, acceptHeader, maxBytes, profile);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader, int maxBytes, Profile profile) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        boolean hostAcquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            Semaphore hostLimiter = hostLimiters.computeIfAbsent(
                host,
                ignored -> new Semaphore(properties.getPerHostConcurrency())
            );
            hostLimiter.acquire();
            hostAcquired = true;
            enforcePerHostDelay(host);

            HttpResponse<InputStream> response = client.send(
                buildRequest(uri, acceptHeader, profile),
                HttpResponse.BodyHandlers.ofInputStream()
            );
            if (profile == Profile.POLITE && (response.statusCode() == 403 || response.statusCode() == 429)) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            byte[] responseBytes;
            try (InputStream in = response.body()) {
                responseBytes = in.readNBytes(Math.max(1, maxBytes) + 1);
            }
            if (responseBytes.length > maxBytes) {
                return errorResult(url, startedAt, "body_too_large", "body exceeded " + maxBytes + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, StandardCharsets.UTF_8),
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (hostAcquired) {
                Semaphore hostLimiter = hostLimiters.get(host);
                if (hostLimiter != null) {
                    hostLimiter.release();
                }
            }
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpRequest buildRequest(URI uri, String acceptHeader, Profile profile) {
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        if (profile == Profile.BROWSER) {
            return HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getFallback().getTimeoutSeconds()))
                .header("User-Agent", properties.getBrowserUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Cache-Control", "no-cache")
                .header("Pragma", "no-cache")
                .header("Upgrade-Insecure-Requests", "1")
                .GET()
                .build();
        }
        return HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", IngestProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return errorCode.equals("timeout") || errorCode.equals("io_error");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private void recordDomainOutcome(String host, HttpFetchResult result) {
        if (host == null || result == null) {
            return;
        }
        if (result.isSuccessful()) {
            domainFailureTracker.recordSuccess(host);
            return;
        }
        String category = blockingCategory(result);
        if (category != null) {
            domainFailureTracker.recordFailure(host, category);
        }
    }

    // 404 and friends say nothing about the site blocking us
    private String blockingCategory(HttpFetchResult result) {
        if (result.errorCode() != null) {
            String code = result.errorCode();
            if (code.equals("timeout") || code.equals("io_error") || code.equals("http_error")) {
                return code;
            }
            return null;
        }
        int status = result.statusCode();
        if (status == 403) {
            return "http_403_forbidden";
        }
        if (status == 429) {
            return "http_429_rate_limit";
        }
        if (status >= 500) {
            return "http_5xx";
        }
        return null;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private enum Profile {
        POLITE,
        BROWSER
    }
}
