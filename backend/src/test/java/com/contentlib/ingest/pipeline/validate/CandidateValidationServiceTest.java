package com.contentlib.ingest.pipeline.validate;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.extract.JsonLdParser;
import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateValidationServiceTest {

    @Mock private PoliteHttpClient httpClient;

    private ExecutorService executor;
    private CandidateValidationService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        JsonLdParser parser = new JsonLdParser(new ObjectMapper());
        PageValidator validator = new PageValidator(parser, new DateExtractor(parser, Clock.systemUTC()), new IngestProperties());
        service = new CandidateValidationService(httpClient, validator, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void rejectsNonArticlesKeepsUnreachablePagesAndEnrichesAccepted() {
        String article = "https://example.com/blog/scaling-our-queue";
        String product = "https://example.com/blog/widget-pro";
        String unreachable = "https://example.com/blog/timeouts-everywhere";
        when(httpClient.get(eq(article), anyString())).thenReturn(ok(article,
            "<html><head><meta property=\"og:title\" content=\"Scaling our queue\">"
                + "<script type=\"application/ld+json\">{\"@type\":\"BlogPosting\",\"datePublished\":\"2024-01-09\"}</script>"
                + "</head><body><article>Short body.</article></body></html>"));
        when(httpClient.get(eq(product), anyString())).thenReturn(ok(product,
            "<html><head><script type=\"application/ld+json\">{\"@type\":\"Product\"}</script></head>"
                + "<body><main>Buy now.</main></body></html>"));
        when(httpClient.get(eq(unreachable), anyString())).thenReturn(failed(unreachable));

        CandidateValidationService.ValidationOutcome outcome = service.validateAll(List.of(
            new DiscoveredUrl(article, "Scaling Our Queue", null, "blog", null),
            new DiscoveredUrl(product, "Widget Pro", null, "blog", null),
            new DiscoveredUrl(unreachable, "Timeouts Everywhere", null, "blog", null)
        ));

        assertThat(outcome.rejectedCount()).isEqualTo(1);
        assertThat(outcome.accepted()).extracting(DiscoveredUrl::url).containsExactly(article, unreachable);
        DiscoveredUrl enriched = outcome.accepted().get(0);
        assertThat(enriched.title()).isEqualTo("Scaling our queue");
        assertThat(enriched.publishedDate()).isEqualTo(LocalDate.of(2024, 1, 9));
        assertThat(outcome.accepted().get(1).title()).isEqualTo("Timeouts Everywhere");
    }

    private static HttpFetchResult ok(String url, String body) {
        return new HttpFetchResult(url, URI.create(url), 200, body, null, "text/html", null,
            Instant.now(), Duration.ZERO, null, null);
    }

    private static HttpFetchResult failed(String url) {
        return new HttpFetchResult(url, null, 0, null, null, null, null,
            Instant.now(), Duration.ZERO, "timeout", "read timed out");
    }
}
