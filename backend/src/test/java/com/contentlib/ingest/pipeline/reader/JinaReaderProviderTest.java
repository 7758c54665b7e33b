package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JinaReaderProviderTest {
    private MockWebServer server;
    private JinaReaderProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestProperties properties = new IngestProperties();
        properties.getReader().getJina().setApiKey("test-key");
        properties.getReader().getJina().setBaseUrl(server.url("/").toString());
        provider = new JinaReaderProvider(properties, new ReaderHttpTransport(HttpClient.newHttpClient()));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void liftsPreambleIntoMetadataAndSendsReaderHeaders() throws Exception {
        String article = "Pricing experiments are easier than they look. ".repeat(5);
        server.enqueue(new MockResponse().setBody(
            "Title: Five pricing experiments\n"
                + "URL Source: https://example.com/blog/five-pricing-experiments\n"
                + "Published Time: 2024-03-12T08:00:00Z\n"
                + "Markdown Content:\n"
                + article
        ));

        ReaderResponse response = provider.fetch(
            new ReaderRequest("https://example.com/blog/five-pricing-experiments", ReaderFormat.MARKDOWN, false));

        assertThat(response.provider()).isEqualTo("jina");
        assertThat(response.content()).startsWith("Pricing experiments");
        assertThat(response.metadataValue("title")).isEqualTo("Five pricing experiments");
        assertThat(response.metadataValue("publishedTime")).isEqualTo("2024-03-12T08:00:00Z");

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/https://example.com/blog/five-pricing-experiments");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(recorded.getHeader("X-Respond-With")).isEqualTo("markdown");
        assertThat(recorded.getHeader("X-Target-Selector")).contains("article");
    }

    @Test
    void shortContentIsReportedAsUnavailable() {
        server.enqueue(new MockResponse().setBody("Title: Stub\nMarkdown Content:\nToo short."));

        assertThatThrownBy(() -> provider.fetch(
            new ReaderRequest("https://example.com/stub", ReaderFormat.MARKDOWN, false)))
            .isInstanceOfSatisfying(ReaderException.class,
                e -> assertThat(e.getCode()).isEqualTo(ReaderErrorCode.CONTENT_UNAVAILABLE));
    }

    @Test
    void rateLimitStatusMapsToRetryableError() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        assertThatThrownBy(() -> provider.fetch(
            new ReaderRequest("https://example.com/post", ReaderFormat.MARKDOWN, false)))
            .isInstanceOfSatisfying(ReaderException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ReaderErrorCode.RATE_LIMITED);
                assertThat(e.getHttpStatus()).isEqualTo(429);
                assertThat(e.isRetryable()).isTrue();
            });
    }

    @Test
    void bodyWithoutMarkerIsReturnedWhole() {
        Map<String, String> metadata = new LinkedHashMap<>();
        String content = JinaReaderProvider.splitPreamble("  plain body  ", metadata);

        assertThat(content).isEqualTo("plain body");
        assertThat(metadata).isEmpty();
    }

    @Test
    void missingApiKeyMeansNotConfigured() {
        IngestProperties properties = new IngestProperties();
        JinaReaderProvider unconfigured = new JinaReaderProvider(properties, new ReaderHttpTransport(HttpClient.newHttpClient()));

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.fetch(
            new ReaderRequest("https://example.com/post", ReaderFormat.MARKDOWN, false)))
            .isInstanceOf(ReaderConfigurationException.class);
    }
}
