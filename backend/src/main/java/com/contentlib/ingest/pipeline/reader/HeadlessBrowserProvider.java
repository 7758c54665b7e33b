package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

@Component
public class HeadlessBrowserProvider implements ReaderProvider {
    static final String NAME = "browser";
    private static final int WAIT_FOR_MS = 3000;

    private final IngestProperties.Provider config;
    private final ReaderHttpTransport transport;
    private final ObjectMapper objectMapper;

    public HeadlessBrowserProvider(IngestProperties properties, ReaderHttpTransport transport, ObjectMapper objectMapper) {
        this.config = properties.getReader().getBrowser();
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public int creditCost() {
        return 0;
    }

    @Override
    public ReaderResponse fetch(ReaderRequest request) {
        if (!isConfigured()) {
            throw new ReaderConfigurationException(NAME, "headless browser endpoint is not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("url", request.url());
        payload.put("waitFor", WAIT_FOR_MS);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode render payload", e);
        }
        String base = config.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(base + "/render"))
            .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "text/html")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getApiKey().trim());
        }
        String html = transport.send(NAME, builder.build());
        if (html == null || html.isBlank()) {
            throw new ReaderException(ReaderErrorCode.CONTENT_UNAVAILABLE, 0, NAME, "renderer returned no html url=" + request.url());
        }
        return new ReaderResponse(html, Map.of(), NAME, 0);
    }
}
