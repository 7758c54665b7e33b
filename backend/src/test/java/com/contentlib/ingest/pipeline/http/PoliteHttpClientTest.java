package com.contentlib.ingest.pipeline.http;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private IngestProperties properties;
    private DomainFailureTracker domainFailureTracker;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new IngestProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        domainFailureTracker = new DomainFailureTracker(properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void reportsBodyTooLargeInsteadOfReturningPartialBody() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5000)));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, domainFailureTracker);

        HttpFetchResult result = client.get(server.url("/big").toString(), "text/plain", 1024);

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.body()).isNull();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void retriesServerErrorsUpToConfiguredLimit() {
        properties.setRequestMaxRetries(1);
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<urlset/>"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, domainFailureTracker);

        HttpFetchResult result = client.get(server.url("/sitemap.xml").toString(), "application/xml");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<urlset/>");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void suppressesDirectFetchesAfterRepeatedBlocking() throws Exception {
        properties.getFallback().setDomainFailureThreshold(3);
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(403));
        }
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, domainFailureTracker);
        String url = server.url("/blog/post-one").toString();

        for (int i = 0; i < 3; i++) {
            assertThat(client.fetchAsBrowser(url).statusCode()).isEqualTo(403);
        }
        HttpFetchResult suppressed = client.fetchAsBrowser(url);

        assertThat(suppressed.errorCode()).isEqualTo("domain_suppressed");
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(domainFailureTracker.suppressedDomains()).hasSize(1);

        RecordedRequest first = server.takeRequest();
        assertThat(first.getHeader("User-Agent")).contains("Mozilla");
    }

    @Test
    void notFoundDoesNotCountTowardSuppression() {
        properties.getFallback().setDomainFailureThreshold(1);
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html></html>"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor, domainFailureTracker);
        String url = server.url("/missing").toString();

        assertThat(client.fetchAsBrowser(url).statusCode()).isEqualTo(404);
        assertThat(client.fetchAsBrowser(url).isSuccessful()).isTrue();
        assertThat(domainFailureTracker.suppressedDomains()).isEmpty();
    }
}
