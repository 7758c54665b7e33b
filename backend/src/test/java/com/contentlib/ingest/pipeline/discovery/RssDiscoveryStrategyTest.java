package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.extract.JsonLdParser;
import com.contentlib.ingest.pipeline.feed.FeedService;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.FeedEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssDiscoveryStrategyTest {

    @Mock private FeedService feedService;

    private RssDiscoveryStrategy strategy;

    @BeforeEach
    void setUp() {
        DateExtractor dateExtractor = new DateExtractor(
            new JsonLdParser(new ObjectMapper()),
            Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC)
        );
        strategy = new RssDiscoveryStrategy(feedService, dateExtractor, new IngestProperties());
    }

    @Test
    void keepsFeedItemsAndFillsMissingTitlesAndDates() {
        when(feedService.discover(eq("https://example.com/blog"), anyInt(), anyMap())).thenReturn(new FeedService.FeedDiscovery(
            "https://example.com/blog/feed",
            List.of(
                new FeedEntry("https://example.com/blog/launch-week-recap", "Launch week recap", LocalDate.of(2024, 5, 3)),
                new FeedEntry("https://example.com/blog/2024/04/18/notes-from-the-field", " ", null),
                new FeedEntry("https://example.com/", "Home", null),
                new FeedEntry("https://example.com/tag/releases", "Releases", null)
            )
        ));

        DiscoveryStrategy.StrategyOutcome outcome = strategy.discover("https://example.com/blog", 50);

        assertThat(outcome.error()).isNull();
        assertThat(outcome.urls()).extracting(DiscoveredUrl::url).containsExactly(
            "https://example.com/blog/launch-week-recap",
            "https://example.com/blog/2024/04/18/notes-from-the-field"
        );
        DiscoveredUrl derived = outcome.urls().get(1);
        assertThat(derived.title()).isEqualTo("Notes From The Field");
        assertThat(derived.publishedDate()).isEqualTo(LocalDate.of(2024, 4, 18));
        assertThat(derived.contentSection()).isEqualTo("blog");
    }

    @Test
    void missingFeedIsReportedWithFetchErrors() {
        when(feedService.discover(eq("https://example.com"), anyInt(), anyMap())).thenAnswer(invocation -> {
            Map<String, Integer> errors = invocation.getArgument(2);
            errors.merge("http_404", 3, Integer::sum);
            return new FeedService.FeedDiscovery(null, List.of());
        });

        DiscoveryStrategy.StrategyOutcome outcome = strategy.discover("https://example.com", 50);

        assertThat(outcome.isEmpty()).isTrue();
        assertThat(outcome.error()).startsWith("no_feed_found").contains("http_404=3");
    }
}
