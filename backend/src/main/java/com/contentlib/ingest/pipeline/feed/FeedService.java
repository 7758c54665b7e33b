package com.contentlib.ingest.pipeline.feed;

import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.FeedEntry;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Service
public class FeedService {
    private static final Logger log = LoggerFactory.getLogger(FeedService.class);
    private static final String FEED_ACCEPT =
        "application/rss+xml,application/atom+xml,application/xml;q=0.9,text/xml;q=0.8,*/*;q=0.1";
    private static final int MAX_FEED_BYTES = 3_000_000;
    private static final List<String> COMMON_FEED_PATHS = List.of(
        "/feed",
        "/rss",
        "/rss.xml",
        "/feed.xml",
        "/atom.xml",
        "/index.xml",
        "/blog/feed",
        "/blog/rss.xml",
        "/blog/feed.xml",
        "/news/feed",
        "/feed/rss"
    );

    private final PoliteHttpClient httpClient;
    private final DateExtractor dateExtractor;

    public FeedService(PoliteHttpClient httpClient, DateExtractor dateExtractor) {
        this.httpClient = httpClient;
        this.dateExtractor = dateExtractor;
    }

    public FeedDiscovery discover(String baseUrl, int maxItems, Map<String, Integer> errors) {
        for (String candidate : candidateFeeds(baseUrl)) {
            HttpFetchResult fetch = httpClient.get(candidate, FEED_ACCEPT, MAX_FEED_BYTES);
            if (!fetch.isSuccessful()) {
                errors.merge(fetch.errorCode() != null ? fetch.errorCode() : "http_" + fetch.statusCode(), 1, Integer::sum);
                continue;
            }
            List<FeedEntry> entries = parse(fetch.body(), fetch.finalUrlOrRequested(), maxItems);
            if (!entries.isEmpty()) {
                log.debug("feed found url={} entries={}", candidate, entries.size());
                return new FeedDiscovery(candidate, entries);
            }
            errors.merge("empty_feed", 1, Integer::sum);
        }
        return new FeedDiscovery(null, List.of());
    }

    public List<FeedEntry> parse(String xmlPayload, String feedUrl, int maxItems) {
        if (xmlPayload == null || xmlPayload.isBlank()) {
            return List.of();
        }
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xmlPayload.strip()));
        } catch (FeedException | IllegalArgumentException e) {
            log.debug("not a feed url={} reason={}", feedUrl, e.getMessage());
            return List.of();
        }

        Map<String, FeedEntry> entries = new LinkedHashMap<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (entries.size() >= maxItems) {
                break;
            }
            String link = entryLink(entry);
            String canonical = link == null ? null : UrlUtils.canonicalize(UrlUtils.resolve(feedUrl, link));
            if (canonical == null || entries.containsKey(canonical)) {
                continue;
            }
            String title = entry.getTitle() == null || entry.getTitle().isBlank() ? null : entry.getTitle().trim();
            Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
            LocalDate published = date == null
                ? null
                : dateExtractor.plausible(date.toInstant().atZone(ZoneOffset.UTC).toLocalDate());
            entries.put(canonical, new FeedEntry(canonical, title, published));
        }
        return List.copyOf(entries.values());
    }

    private List<String> candidateFeeds(String baseUrl) {
        String origin = UrlUtils.origin(baseUrl);
        LinkedHashSet<String> candidates = new LinkedHashSet<>();
        HttpFetchResult home = httpClient.get(baseUrl, PoliteHttpClient.HTML_ACCEPT);
        if (home.isSuccessful() && home.body() != null) {
            Document document = Jsoup.parse(home.body(), home.finalUrlOrRequested());
            for (Element link : document.select("link[rel=alternate][type*=rss], link[rel=alternate][type*=atom]")) {
                String href = link.absUrl("href");
                if (!href.isBlank()) {
                    candidates.add(href);
                }
            }
        }
        String path = UrlUtils.path(baseUrl);
        if (path.length() > 1) {
            String section = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
            candidates.add(origin + section + "/feed");
            candidates.add(origin + section + "/rss.xml");
            candidates.add(origin + section + "/feed.xml");
        }
        for (String feedPath : COMMON_FEED_PATHS) {
            candidates.add(origin + feedPath);
        }
        return new ArrayList<>(candidates);
    }

    private String entryLink(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink().trim();
        }
        String uri = entry.getUri();
        if (uri != null && (uri.startsWith("http://") || uri.startsWith("https://"))) {
            return uri.trim();
        }
        return null;
    }

    public record FeedDiscovery(String feedUrl, List<FeedEntry> entries) {
    }
}
