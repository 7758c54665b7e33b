package com.contentlib.ingest.pipeline.validate;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.extract.JsonLdParser;
import com.contentlib.ingest.pipeline.model.PageValidation;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Component
public class PageValidator {
    static final Set<String> ARTICLE_TYPES = Set.of("blogposting", "newsarticle", "article", "report", "techarticle");
    static final Set<String> NON_ARTICLE_TYPES = Set.of(
        "product",
        "service",
        "organization",
        "webpage",
        "collectionpage",
        "faqpage",
        "aboutpage",
        "contactpage",
        "searchresultspage",
        "itemlist",
        "localbusiness",
        "softwareapplication"
    );
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
    private static final String CHROME_SELECTOR = "script, style, noscript, template, nav, header, footer, aside, form";
    private static final int MIN_H1_CHARS = 5;

    private final JsonLdParser jsonLdParser;
    private final DateExtractor dateExtractor;
    private final int minWordCount;

    public PageValidator(JsonLdParser jsonLdParser, DateExtractor dateExtractor, IngestProperties properties) {
        this.jsonLdParser = jsonLdParser;
        this.dateExtractor = dateExtractor;
        this.minWordCount = properties.getValidation().getMinWordCount();
    }

    public PageValidation validate(String url, String html) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        List<JsonNode> nodes = jsonLdParser.typedNodes(document);
        Set<String> types = jsonLdParser.types(nodes);
        String title = title(document);
        LocalDate publishedDate = dateExtractor.fromDocument(document, url);
        int wordCount = wordCount(mainContent(document).text());

        if (types.stream().anyMatch(ARTICLE_TYPES::contains)) {
            return new PageValidation(true, types, publishedDate, title, wordCount, "article_schema");
        }
        if (types.stream().anyMatch(NON_ARTICLE_TYPES::contains) && wordCount < minWordCount) {
            return new PageValidation(false, types, publishedDate, title, wordCount, "non_article_schema");
        }
        if (hasDateSignal(document)) {
            return new PageValidation(true, types, publishedDate, title, wordCount, "date_signal");
        }
        if (wordCount >= minWordCount) {
            return new PageValidation(true, types, publishedDate, title, wordCount, "word_count");
        }
        String slug = UrlUtils.lastSegment(url);
        if (slug != null && slug.contains("-")) {
            return new PageValidation(true, types, publishedDate, title, wordCount, "slug_url");
        }
        return new PageValidation(false, types, publishedDate, title, wordCount, "no_article_signal");
    }

    String title(Document document) {
        String og = metaContent(document, "meta[property=og:title]");
        if (og != null) {
            return og;
        }
        String twitter = metaContent(document, "meta[name=twitter:title], meta[property=twitter:title]");
        if (twitter != null) {
            return twitter;
        }
        Element h1 = document.selectFirst("h1");
        if (h1 != null && h1.text().trim().length() >= MIN_H1_CHARS) {
            return h1.text().trim();
        }
        String title = document.title();
        return title == null || title.isBlank() ? null : title.trim();
    }

    Element mainContent(Document document) {
        Document copy = document.clone();
        copy.select(CHROME_SELECTOR).remove();
        for (String selector : MAIN_CONTENT_SELECTORS) {
            Element candidate = copy.selectFirst(selector);
            if (candidate != null && !candidate.text().isBlank()) {
                return candidate;
            }
        }
        return copy.body() == null ? copy : copy.body();
    }

    private boolean hasDateSignal(Document document) {
        return dateExtractor.fromMetaTags(document) != null || !document.select("time").isEmpty();
    }

    private String metaContent(Document document, String selector) {
        Element meta = document.selectFirst(selector);
        if (meta == null) {
            return null;
        }
        String content = meta.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
