package com.contentlib.ingest.pipeline.http;

import com.contentlib.ingest.config.IngestProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainFailureTrackerTest {

    @Test
    void suppressesAfterThresholdAndSuccessResets() {
        DomainFailureTracker tracker = new DomainFailureTracker(new IngestProperties());

        tracker.recordFailure("www.example.com", "http_403");
        tracker.recordFailure("example.com", "timeout");
        assertThat(tracker.isSuppressed("example.com")).isFalse();

        tracker.recordFailure("EXAMPLE.com", "http_503");
        assertThat(tracker.isSuppressed("www.example.com")).isTrue();
        assertThat(tracker.suppressedDomains()).containsExactly("example.com");

        tracker.recordSuccess("example.com");
        assertThat(tracker.isSuppressed("example.com")).isFalse();
        assertThat(tracker.failureCount("example.com")).isZero();
    }

    @Test
    void thresholdComesFromConfiguration() {
        IngestProperties properties = new IngestProperties();
        properties.getFallback().setDomainFailureThreshold(1);
        DomainFailureTracker tracker = new DomainFailureTracker(properties);

        tracker.recordFailure("blocked.example.org", "http_429");

        assertThat(tracker.isSuppressed("blocked.example.org")).isTrue();
        assertThat(tracker.isSuppressed(null)).isFalse();
    }
}
