package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.feed.FeedService;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.FeedEntry;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class RssDiscoveryStrategy implements DiscoveryStrategy {
    private final FeedService feedService;
    private final DateExtractor dateExtractor;
    private final int maxItems;

    public RssDiscoveryStrategy(FeedService feedService, DateExtractor dateExtractor, IngestProperties properties) {
        this.feedService = feedService;
        this.dateExtractor = dateExtractor;
        this.maxItems = properties.getDiscovery().getRss().getMaxItems();
    }

    @Override
    public StrategyOutcome discover(String baseUrl, int maxUrls) {
        Map<String, Integer> errors = new LinkedHashMap<>();
        FeedService.FeedDiscovery feed = feedService.discover(baseUrl, maxItems, errors);
        List<DiscoveredUrl> posts = new ArrayList<>();
        for (FeedEntry entry : feed.entries()) {
            String url = entry.url();
            if (UrlHeuristics.isExcluded(url) || UrlUtils.pathSegments(url).isEmpty()) {
                continue;
            }
            String title = entry.title() == null || entry.title().isBlank()
                ? UrlHeuristics.deriveTitleFromSlug(url)
                : entry.title().trim();
            LocalDate published = entry.publishedDate() != null ? entry.publishedDate() : dateExtractor.fromUrl(url);
            posts.add(new DiscoveredUrl(url, title, published, UrlHeuristics.contentSection(url), UrlLanguageDetector.detect(url)));
        }
        String error = feed.feedUrl() == null ? "no_feed_found " + errors : null;
        return StrategyOutcome.found(posts, 0, error);
    }
}
