package com.contentlib.ingest.pipeline.http;

import com.contentlib.ingest.config.IngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DomainFailureTracker {
    private static final Logger log = LoggerFactory.getLogger(DomainFailureTracker.class);

    private final IngestProperties properties;
    private final Map<String, DomainState> states = new ConcurrentHashMap<>();

    public DomainFailureTracker(IngestProperties properties) {
        this.properties = properties;
    }

    public boolean isSuppressed(String host) {
        if (host == null || host.isBlank()) {
            return false;
        }
        DomainState state = states.get(normalizeHost(host));
        return state != null && state.consecutiveFailures() >= properties.getFallback().getDomainFailureThreshold();
    }

    public int failureCount(String host) {
        if (host == null || host.isBlank()) {
            return 0;
        }
        DomainState state = states.get(normalizeHost(host));
        return state == null ? 0 : state.consecutiveFailures();
    }

    public void recordFailure(String host, String category) {
        if (host == null || host.isBlank()) {
            return;
        }
        String normalized = normalizeHost(host);
        DomainState next = states.merge(
            normalized,
            new DomainState(1, category, Instant.now()),
            (existing, ignored) -> new DomainState(existing.consecutiveFailures() + 1, category, Instant.now())
        );
        if (next.consecutiveFailures() == properties.getFallback().getDomainFailureThreshold()) {
            log.warn(
                "direct fetch suppressed domain={} failures={} lastCategory={}",
                normalized,
                next.consecutiveFailures(),
                category
            );
        }
    }

    public void recordSuccess(String host) {
        if (host == null || host.isBlank()) {
            return;
        }
        states.remove(normalizeHost(host));
    }

    public List<String> suppressedDomains() {
        int threshold = properties.getFallback().getDomainFailureThreshold();
        return states.entrySet().stream()
            .filter(entry -> entry.getValue().consecutiveFailures() >= threshold)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    private String normalizeHost(String host) {
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("www.") ? normalized.substring(4) : normalized;
    }

    private record DomainState(int consecutiveFailures, String lastCategory, Instant lastFailureAt) {
    }
}
