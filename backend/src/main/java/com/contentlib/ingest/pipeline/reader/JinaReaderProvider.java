package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class JinaReaderProvider implements ReaderProvider {
    static final String NAME = "jina";
    static final int MIN_CONTENT_CHARS = 100;
    private static final String REMOVE_SELECTOR =
        "nav,footer,header,.navigation,.sidebar,.menu,.breadcrumb,.social-share,.related-posts,"
            + ".comments,.newsletter,.subscribe,.cookie-banner,.popup,.modal";
    private static final String TARGET_SELECTOR =
        "article,main,.post-content,.entry-content,.article-content,.blog-post,.post-body,.content-main";
    private static final String CONTENT_MARKER = "Markdown Content:";

    private final IngestProperties.Provider config;
    private final ReaderHttpTransport transport;

    public JinaReaderProvider(IngestProperties properties, ReaderHttpTransport transport) {
        this.config = properties.getReader().getJina();
        this.transport = transport;
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
        return 0;
    }

    @Override
    public ReaderResponse fetch(ReaderRequest request) {
        if (!isConfigured()) {
            throw new ReaderConfigurationException(NAME, "jina api key is not configured");
        }
        String format = request.format() == ReaderFormat.HTML ? "html" : "markdown";
        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(stripTrailingSlash(config.getBaseUrl()) + "/" + request.url()))
            .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + config.getApiKey().trim())
            .header("Accept", "text/plain")
            .header("X-Respond-With", format)
            .header("X-With-Generated-Alt", "true")
            .header("X-No-Cache", "true")
            .header("X-Timeout", String.valueOf(config.getTimeoutSeconds()))
            .header("X-Remove-Selector", REMOVE_SELECTOR)
            .header("X-Target-Selector", TARGET_SELECTOR)
            .GET()
            .build();

        String body = transport.send(NAME, httpRequest);
        Map<String, String> metadata = new LinkedHashMap<>();
        String content = splitPreamble(body == null ? "" : body, metadata);
        if (content.trim().length() < MIN_CONTENT_CHARS) {
            throw new ReaderException(
                ReaderErrorCode.CONTENT_UNAVAILABLE,
                0,
                NAME,
                "content too short chars=" + content.trim().length() + " url=" + request.url()
            );
        }
        return new ReaderResponse(content, metadata, NAME, creditCost());
    }

    static String splitPreamble(String body, Map<String, String> metadata) {
        int marker = body.indexOf(CONTENT_MARKER);
        if (marker < 0) {
            return body.trim();
        }
        for (String line : body.substring(0, marker).split("\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            if (value.isEmpty()) {
                continue;
            }
            switch (key) {
                case "title" -> metadata.put("title", value);
                case "url source" -> metadata.put("sourceURL", value);
                case "published time" -> metadata.put("publishedTime", value);
                default -> metadata.put(key, value);
            }
        }
        return body.substring(marker + CONTENT_MARKER.length()).trim();
    }

    private static String stripTrailingSlash(String base) {
        String trimmed = base.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
