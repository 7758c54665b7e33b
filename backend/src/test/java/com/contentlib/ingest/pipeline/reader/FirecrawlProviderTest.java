package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.MapResult;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FirecrawlProviderTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private FirecrawlProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestProperties properties = new IngestProperties();
        properties.getReader().getFirecrawl().setApiKey("fc-test");
        properties.getReader().getFirecrawl().setBaseUrl(server.url("/").toString());
        properties.getReader().setLocationCountry("DE");
        provider = new FirecrawlProvider(properties, new ReaderHttpTransport(HttpClient.newHttpClient()), objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void scrapesMarkdownAndFlattensMetadata() throws Exception {
        server.enqueue(json("{\"success\":true,\"data\":{\"markdown\":\"# Hello\\n\\nBody text.\","
            + "\"metadata\":{\"title\":[\"Hello world\"],\"publishedTime\":\"2024-04-02\",\"creditsUsed\":2}}}"));

        ReaderResponse response = provider.fetch(
            new ReaderRequest("https://example.com/blog/hello-world", ReaderFormat.MARKDOWN, true));

        assertThat(response.content()).startsWith("# Hello");
        assertThat(response.metadataValue("title")).isEqualTo("Hello world");
        assertThat(response.metadataValue("publishedTime")).isEqualTo("2024-04-02");
        assertThat(response.creditsUsed()).isEqualTo(2);

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/scrape");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer fc-test");
        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.path("url").asText()).isEqualTo("https://example.com/blog/hello-world");
        assertThat(body.path("formats").get(0).asText()).isEqualTo("markdown");
        assertThat(body.path("onlyMainContent").asBoolean()).isTrue();
        assertThat(body.path("location").path("country").asText()).isEqualTo("DE");
    }

    @Test
    void unsuccessfulScrapeIsContentUnavailable() {
        server.enqueue(json("{\"success\":false,\"error\":\"page blocked\"}"));

        assertThatThrownBy(() -> provider.fetch(
                new ReaderRequest("https://example.com/blog/blocked", ReaderFormat.MARKDOWN, false)))
            .isInstanceOfSatisfying(ReaderException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ReaderErrorCode.CONTENT_UNAVAILABLE);
                assertThat(e.getMessage()).contains("page blocked");
            });
    }

    @Test
    void mapDropsExcludedPathsAndNonHttpLinks() {
        server.enqueue(json("{\"success\":true,\"links\":["
            + "\"https://example.com/blog/first-post\","
            + "\"https://example.com/tag/java\","
            + "{\"url\":\"https://example.com/blog/second-post\"},"
            + "\"mailto:team@example.com\","
            + "\"https://example.com/blog/first-post\"]}"));

        MapResult result = provider.map("https://example.com", 100, new IngestProperties().getDiscovery().getMap().getExcludedPaths());

        assertThat(result.links()).containsExactly(
            "https://example.com/blog/first-post",
            "https://example.com/blog/second-post"
        );
    }

    @Test
    void missingKeyIsNotConfigured() {
        IngestProperties properties = new IngestProperties();
        FirecrawlProvider unconfigured = new FirecrawlProvider(
            properties, new ReaderHttpTransport(HttpClient.newHttpClient()), objectMapper);

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.fetch(
                new ReaderRequest("https://example.com/blog/a", ReaderFormat.MARKDOWN, false)))
            .isInstanceOf(ReaderConfigurationException.class);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
