package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DirectFetchFallback {
    static final String NAME = "direct";
    private static final List<String> MAIN_CONTENT_SELECTORS = List.of(
        "article",
        "main",
        "[role=main]",
        ".post-content",
        ".entry-content",
        ".article-content",
        "#main",
        "#content"
    );
    private static final String NOISE_SELECTOR =
        "script, style, noscript, iframe, svg, nav, header, footer, aside, form, .sidebar, .menu, "
            + ".breadcrumb, .social-share, .related-posts, .comments, .newsletter, .cookie-banner";

    private final PoliteHttpClient httpClient;
    private final FlexmarkHtmlConverter converter = FlexmarkHtmlConverter.builder().build();

    public DirectFetchFallback(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ReaderResponse fetch(String url, ReaderFormat format) {
        HttpFetchResult result = httpClient.fetchAsBrowser(url);
        if (!result.isSuccessful()) {
            throw new ReaderException(failureCode(result), result.statusCode(), NAME, "direct fetch failed: " + result.describeFailure());
        }
        String html = result.body() == null ? "" : result.body();
        if (format == ReaderFormat.HTML) {
            return new ReaderResponse(html, Map.of("sourceURL", result.finalUrlOrRequested()), NAME, 0);
        }

        Document document = Jsoup.parse(html, result.finalUrlOrRequested());
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("sourceURL", result.finalUrlOrRequested());
        String title = document.title();
        if (title != null && !title.isBlank()) {
            metadata.put("title", title.trim());
        }
        for (Element meta : document.select("meta[property], meta[name]")) {
            String key = meta.hasAttr("property") ? meta.attr("property") : meta.attr("name");
            String value = meta.attr("content");
            if (!key.isBlank() && !value.isBlank()) {
                metadata.putIfAbsent(key, value.trim());
            }
        }

        String markdown = converter.convert(mainContent(document).outerHtml());
        if (markdown == null || markdown.isBlank()) {
            throw new ReaderException(ReaderErrorCode.CONTENT_UNAVAILABLE, 0, NAME, "no readable content url=" + url);
        }
        return new ReaderResponse(markdown.trim(), metadata, NAME, 0);
    }

    private ReaderErrorCode failureCode(HttpFetchResult result) {
        if ("timeout".equals(result.errorCode())) {
            return ReaderErrorCode.TIMEOUT;
        }
        if ("domain_suppressed".equals(result.errorCode())) {
            return ReaderErrorCode.REJECTED;
        }
        if (result.statusCode() > 0) {
            return ReaderException.siteStatusCode(result.statusCode());
        }
        return ReaderErrorCode.NETWORK;
    }

    private Element mainContent(Document document) {
        Document copy = document.clone();
        copy.select(NOISE_SELECTOR).remove();
        for (String selector : MAIN_CONTENT_SELECTORS) {
            Element candidate = copy.selectFirst(selector);
            if (candidate != null && !candidate.text().isBlank()) {
                return candidate;
            }
        }
        return copy.body() == null ? copy : copy.body();
    }
}
