package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.pipeline.model.DiscoveredUrl;

import java.util.List;

/**
 * One way of listing the posts of a site. Implementations never throw for site-level problems;
 * they return an empty outcome with an error description instead.
 */
public interface DiscoveryStrategy {
    StrategyOutcome discover(String baseUrl, int maxUrls);

    record StrategyOutcome(List<DiscoveredUrl> urls, int creditsUsed, String error) {
        public static StrategyOutcome found(List<DiscoveredUrl> urls, int creditsUsed, String error) {
            return new StrategyOutcome(List.copyOf(urls), creditsUsed, error);
        }

        public static StrategyOutcome empty(String error) {
            return new StrategyOutcome(List.of(), 0, error);
        }

        public boolean isEmpty() {
            return urls.isEmpty();
        }
    }
}
