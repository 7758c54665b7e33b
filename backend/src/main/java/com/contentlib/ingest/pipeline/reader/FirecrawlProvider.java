package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.MapResult;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class FirecrawlProvider implements ReaderProvider {
    static final String NAME = "firecrawl";
    static final int WAIT_FOR_MS = 2000;

    private final IngestProperties.Provider config;
    private final IngestProperties.Reader readerConfig;
    private final ReaderHttpTransport transport;
    private final ObjectMapper objectMapper;

    public FirecrawlProvider(IngestProperties properties, ReaderHttpTransport transport, ObjectMapper objectMapper) {
        this.readerConfig = properties.getReader();
        this.config = readerConfig.getFirecrawl();
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public int creditCost() {
        return 1;
    }

    @Override
    public ReaderResponse fetch(ReaderRequest request) {
        requireKey();
        String format = request.format() == ReaderFormat.HTML ? "html" : "markdown";
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("url", request.url());
        payload.putArray("formats").add(format);
        payload.put("onlyMainContent", request.format() != ReaderFormat.HTML);
        payload.put("waitFor", WAIT_FOR_MS);
        payload.put("timeout", config.getTimeoutSeconds() * 1000);
        if (request.useLocationProxy()) {
            payload.putObject("location").put("country", readerConfig.getLocationCountry());
        }

        JsonNode root = post("/v1/scrape", payload);
        JsonNode data = root.path("data");
        String content = data.path(format).asText("");
        if (content.isBlank()) {
            throw new ReaderException(ReaderErrorCode.CONTENT_UNAVAILABLE, 0, NAME, "scrape returned empty content url=" + request.url());
        }
        Map<String, String> metadata = flattenMetadata(data.path("metadata"));
        int credits = data.path("metadata").path("creditsUsed").asInt(creditCost());
        return new ReaderResponse(content, metadata, NAME, Math.max(creditCost(), credits));
    }

    /**
     * Lists URLs of a site, dropping paths that match the glob-style exclusions.
     */
    public MapResult map(String baseUrl, int limit, List<String> excludedPaths) {
        requireKey();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("url", baseUrl);
        payload.put("limit", Math.max(1, limit));

        JsonNode root = post("/v1/map", payload);
        List<Pattern> excludes = new ArrayList<>();
        for (String glob : excludedPaths) {
            excludes.add(Pattern.compile("^" + Pattern.quote(glob).replace("*", "\\E.*\\Q") + "$"));
        }
        LinkedHashSet<String> links = new LinkedHashSet<>();
        for (JsonNode link : root.path("links")) {
            String url = link.isTextual() ? link.asText() : link.path("url").asText("");
            if (url.isBlank() || !UrlUtils.isHttpUrl(url)) {
                continue;
            }
            String path = UrlUtils.path(url);
            boolean excluded = false;
            for (Pattern exclude : excludes) {
                if (exclude.matcher(path).matches()) {
                    excluded = true;
                    break;
                }
            }
            if (!excluded) {
                links.add(url);
            }
        }
        return new MapResult(List.copyOf(links), 1);
    }

    private JsonNode post(String path, ObjectNode payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode firecrawl payload", e);
        }
        String base = config.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(base + path))
            .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + config.getApiKey().trim())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        String response = transport.send(NAME, request);
        try {
            JsonNode root = objectMapper.readTree(response == null ? "" : response);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ReaderException(ReaderErrorCode.SERVICE_UNAVAILABLE, 0, NAME, "empty response from " + path);
            }
            if (root.has("success") && !root.path("success").asBoolean(true)) {
                throw new ReaderException(
                    ReaderErrorCode.CONTENT_UNAVAILABLE,
                    0,
                    NAME,
                    root.path("error").asText("request rejected") + " path=" + path
                );
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ReaderException(ReaderErrorCode.SERVICE_UNAVAILABLE, NAME, "malformed response from " + path, e);
        }
    }

    private Map<String, String> flattenMetadata(JsonNode metadata) {
        Map<String, String> values = new LinkedHashMap<>();
        if (!metadata.isObject()) {
            return values;
        }
        metadata.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isArray() && !value.isEmpty()) {
                value = value.get(0);
            }
            if (value.isValueNode() && !value.asText().isBlank()) {
                values.put(entry.getKey(), value.asText().trim());
            }
        });
        return values;
    }

    private void requireKey() {
        if (!isConfigured()) {
            throw new ReaderConfigurationException(NAME, "firecrawl api key is not configured");
        }
    }
}
