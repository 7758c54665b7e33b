package com.contentlib.ingest.pipeline.extract;

import com.contentlib.ingest.pipeline.discovery.UrlHeuristics;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.contentlib.ingest.pipeline.model.ScrapeReport;
import com.contentlib.ingest.pipeline.model.ScrapedPost;
import com.contentlib.ingest.pipeline.reader.ResilientReaderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ScrapeOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestrator.class);
    private static final List<String> TITLE_KEYS = List.of("title", "ogTitle", "og:title", "twitter:title");
    private static final Pattern FIRST_HEADING = Pattern.compile("(?m)^#{1,3}\\s+(.+?)\\s*#*\\s*$");

    private final ResilientReaderClient readerClient;
    private final ContentCleaner contentCleaner;
    private final DateExtractor dateExtractor;

    public ScrapeOrchestrator(ResilientReaderClient readerClient, ContentCleaner contentCleaner, DateExtractor dateExtractor) {
        this.readerClient = readerClient;
        this.contentCleaner = contentCleaner;
        this.dateExtractor = dateExtractor;
    }

    public ScrapeReport scrapeSelected(List<String> urls, ScrapeProgressListener listener) {
        readerClient.requireConfigured();
        ScrapeProgressListener progress = listener == null ? ScrapeProgressListener.NONE : listener;

        List<ScrapedPost> posts = new ArrayList<>(urls.size());
        int succeeded = 0;
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            ScrapedPost post = scrapeOne(url);
            posts.add(post);
            if (post.success()) {
                succeeded++;
            }
            progress.onProgress(i + 1, urls.size());
        }
        log.info("scrape finished total={} succeeded={} failed={}", urls.size(), succeeded, urls.size() - succeeded);
        return new ScrapeReport(posts, succeeded, urls.size() - succeeded, readerClient.status().credits());
    }

    private ScrapedPost scrapeOne(String url) {
        try {
            ReaderResponse response = readerClient.fetch(url, ReaderFormat.MARKDOWN);
            String content = contentCleaner.clean(response.content());
            if (content.isBlank()) {
                return ScrapedPost.failed(url, UrlHeuristics.deriveTitleFromSlug(url), "no content after cleaning");
            }
            String title = resolveTitle(response, content, url);
            LocalDate published = dateExtractor.fromContent(content, response.metadata(), url);
            log.debug("scraped url={} provider={} chars={}", url, response.provider(), content.length());
            return new ScrapedPost(url, title, content, published, true, null);
        } catch (RuntimeException e) {
            log.warn("scrape failed url={} error={}", url, e.getMessage());
            String message = e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
            return ScrapedPost.failed(url, UrlHeuristics.deriveTitleFromSlug(url), message);
        }
    }

    private String resolveTitle(ReaderResponse response, String content, String url) {
        for (String key : TITLE_KEYS) {
            String value = response.metadataValue(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        Matcher heading = FIRST_HEADING.matcher(content);
        if (heading.find()) {
            return heading.group(1).replaceAll("[*_`]", "").trim();
        }
        return UrlHeuristics.deriveTitleFromSlug(url);
    }
}
