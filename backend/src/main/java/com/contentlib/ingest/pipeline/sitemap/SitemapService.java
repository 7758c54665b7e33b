package com.contentlib.ingest.pipeline.sitemap;

import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.contentlib.ingest.pipeline.model.SitemapDiscoveryResult;
import com.contentlib.ingest.pipeline.model.SitemapFetchRecord;
import com.contentlib.ingest.pipeline.model.SitemapUrlEntry;
import com.contentlib.ingest.pipeline.robots.RobotsTxtService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    public static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    private static final int MAX_SITEMAP_BYTES = 2_000_000;

    private final PoliteHttpClient httpClient;
    private final RobotsTxtService robotsTxtService;

    public SitemapService(PoliteHttpClient httpClient, RobotsTxtService robotsTxtService) {
        this.httpClient = httpClient;
        this.robotsTxtService = robotsTxtService;
    }

    /**
     * Walks the seeds in order, each one as its own index tree. The first tree that yields page
     * entries ends the walk; later seeds are only tried when earlier ones are missing or empty.
     */
    public SitemapDiscoveryResult discover(
        List<String> seedSitemaps,
        int maxDepth,
        int maxChildSitemaps,
        int maxUrls
    ) {
        LinkedHashSet<String> visitedSitemaps = new LinkedHashSet<>();
        LinkedHashMap<String, String> discoveredUrls = new LinkedHashMap<>();
        List<SitemapFetchRecord> fetchedRecords = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();

        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized == null || visitedSitemaps.contains(normalized)) {
                continue;
            }
            walkTree(normalized, maxDepth, maxChildSitemaps, maxUrls, visitedSitemaps, discoveredUrls, fetchedRecords, errors);
            if (!discoveredUrls.isEmpty()) {
                log.debug("sitemap seed productive seed={} urls={}", normalized, discoveredUrls.size());
                break;
            }
        }

        List<SitemapUrlEntry> entries = discoveredUrls.entrySet().stream()
            .map(entry -> new SitemapUrlEntry(entry.getKey(), entry.getValue()))
            .toList();
        return new SitemapDiscoveryResult(fetchedRecords, entries, errors);
    }

    private void walkTree(
        String root,
        int maxDepth,
        int maxChildSitemaps,
        int maxUrls,
        LinkedHashSet<String> visitedSitemaps,
        LinkedHashMap<String, String> discoveredUrls,
        List<SitemapFetchRecord> fetchedRecords,
        Map<String, Integer> errors
    ) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        queue.addLast(new SitemapTask(root, 0));

        while (!queue.isEmpty()) {
            SitemapTask current = queue.removeFirst();
            if (current.depth() > maxDepth || !visitedSitemaps.add(current.url())) {
                continue;
            }
            if (!robotsTxtService.isAllowed(current.url())) {
                increment(errors, "blocked_by_robots");
                continue;
            }

            HttpFetchResult fetch = httpClient.get(current.url(), SITEMAP_ACCEPT, MAX_SITEMAP_BYTES);
            if (!fetch.isSuccessful()) {
                increment(errors, errorKey(fetch));
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(fetch);
            } catch (IOException e) {
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }
            if (!looksLikeXml(xmlPayload)) {
                // soft 404 pages served with 200
                increment(errors, "not_xml");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            List<Element> childSitemaps = xml.select("sitemap > loc");
            if (!childSitemaps.isEmpty() && current.depth() < maxDepth) {
                int queued = 0;
                for (Element loc : prioritizeChildren(childSitemaps)) {
                    if (queued >= maxChildSitemaps) {
                        break;
                    }
                    String child = normalizeSitemapUrl(loc.text());
                    if (child != null && !visitedSitemaps.contains(child)) {
                        queue.addLast(new SitemapTask(child, current.depth() + 1));
                        queued++;
                    }
                }
            }

            int urlCountFromCurrent = 0;
            for (Element urlElement : xml.select("url")) {
                Element locElement = urlElement.selectFirst("loc");
                if (locElement == null) {
                    continue;
                }
                String loc = normalizeSitemapUrl(locElement.text());
                if (loc == null || discoveredUrls.containsKey(loc) || discoveredUrls.size() >= maxUrls) {
                    continue;
                }
                Element lastmodElement = urlElement.selectFirst("lastmod");
                discoveredUrls.put(loc, lastmodElement == null ? null : lastmodElement.text().trim());
                urlCountFromCurrent++;
            }

            fetchedRecords.add(new SitemapFetchRecord(current.url(), Instant.now(), urlCountFromCurrent));
            if (discoveredUrls.size() >= maxUrls) {
                return;
            }
        }
    }

    // post and blog sitemaps first so the child cap does not spend itself on product or tag maps
    private List<Element> prioritizeChildren(List<Element> children) {
        List<Element> preferred = new ArrayList<>();
        List<Element> neutral = new ArrayList<>();
        List<Element> unlikely = new ArrayList<>();
        for (Element child : children) {
            String text = child.text().toLowerCase(Locale.ROOT);
            if (text.contains("post") || text.contains("blog") || text.contains("article") || text.contains("news")) {
                preferred.add(child);
            } else if (text.contains("tag") || text.contains("category") || text.contains("author")
                || text.contains("product") || text.contains("attachment")) {
                unlikely.add(child);
            } else {
                neutral.add(child);
            }
        }
        List<Element> ordered = new ArrayList<>(preferred);
        ordered.addAll(neutral);
        ordered.addAll(unlikely);
        return ordered;
    }

    private boolean looksLikeXml(String payload) {
        String head = payload.stripLeading();
        head = head.substring(0, Math.min(head.length(), 512)).toLowerCase(Locale.ROOT);
        return head.startsWith("<?xml") || head.contains("<urlset") || head.contains("<sitemapindex");
    }

    private String errorKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        if (fetch.statusCode() > 0) {
            return "http_" + fetch.statusCode();
        }
        return "unknown_error";
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }
        if (isGzipPayload(bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    // .gz names and gzip headers are unreliable: the transport may already have inflated the body
    private boolean isGzipPayload(byte[] bodyBytes) {
        return bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            return null;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
