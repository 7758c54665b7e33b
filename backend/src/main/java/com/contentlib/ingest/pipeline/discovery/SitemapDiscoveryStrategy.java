package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.SitemapDiscoveryResult;
import com.contentlib.ingest.pipeline.model.SitemapUrlEntry;
import com.contentlib.ingest.pipeline.robots.RobotsTxtService;
import com.contentlib.ingest.pipeline.sitemap.SitemapService;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class SitemapDiscoveryStrategy implements DiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(SitemapDiscoveryStrategy.class);
    private static final List<String> COMMON_SITEMAP_PATHS = List.of(
        "/sitemap.xml",
        "/sitemap_index.xml",
        "/sitemap-index.xml",
        "/wp-sitemap.xml",
        "/wp-sitemap-posts-post-1.xml",
        "/post-sitemap.xml",
        "/sitemap-posts.xml",
        "/sitemap-blog.xml",
        "/news-sitemap.xml",
        "/articles-sitemap.xml"
    );

    private final SitemapService sitemapService;
    private final RobotsTxtService robotsTxtService;
    private final DateExtractor dateExtractor;
    private final IngestProperties.Sitemap config;

    public SitemapDiscoveryStrategy(
        SitemapService sitemapService,
        RobotsTxtService robotsTxtService,
        DateExtractor dateExtractor,
        IngestProperties properties
    ) {
        this.sitemapService = sitemapService;
        this.robotsTxtService = robotsTxtService;
        this.dateExtractor = dateExtractor;
        this.config = properties.getDiscovery().getSitemap();
    }

    @Override
    public StrategyOutcome discover(String baseUrl, int maxUrls) {
        SitemapDiscoveryResult result = sitemapService.discover(
            seeds(baseUrl),
            config.getMaxDepth(),
            config.getMaxChildSitemaps(),
            config.getMaxUrls()
        );

        Map<String, DiscoveredUrl> posts = new LinkedHashMap<>();
        int rejected = 0;
        for (SitemapUrlEntry entry : result.discoveredUrls()) {
            String url = UrlUtils.canonicalize(entry.url());
            if (url == null || posts.containsKey(url)) {
                continue;
            }
            if (!UrlUtils.sameSite(url, baseUrl) || !UrlHeuristics.looksLikePost(url)) {
                rejected++;
                continue;
            }
            LocalDate published = dateExtractor.parse(entry.lastmod());
            if (published == null) {
                published = dateExtractor.fromUrl(url);
            }
            posts.put(url, new DiscoveredUrl(
                url,
                UrlHeuristics.deriveTitleFromSlug(url),
                published,
                UrlHeuristics.contentSection(url),
                UrlLanguageDetector.detect(url)
            ));
        }
        log.debug(
            "sitemap discovery base={} sitemaps={} entries={} posts={} rejected={}",
            baseUrl,
            result.fetchedSitemaps().size(),
            result.discoveredUrls().size(),
            posts.size(),
            rejected
        );
        return StrategyOutcome.found(new ArrayList<>(posts.values()), 0, describeErrors(result));
    }

    List<String> seeds(String baseUrl) {
        String origin = UrlUtils.origin(baseUrl);
        LinkedHashSet<String> seeds = new LinkedHashSet<>(robotsTxtService.sitemapHints(baseUrl));
        List<String> segments = UrlUtils.pathSegments(baseUrl);
        if (!segments.isEmpty()) {
            String section = segments.get(0).toLowerCase(Locale.ROOT);
            seeds.add(origin + "/" + section + "/sitemap.xml");
            seeds.add(origin + "/sitemap-" + section + ".xml");
            seeds.add(origin + "/sitemap_" + section + ".xml");
        }
        for (String path : COMMON_SITEMAP_PATHS) {
            seeds.add(origin + path);
        }
        return new ArrayList<>(seeds);
    }

    private String describeErrors(SitemapDiscoveryResult result) {
        if (result.errors().isEmpty()) {
            return null;
        }
        StringBuilder description = new StringBuilder();
        result.errors().forEach((key, count) -> {
            if (description.length() > 0) {
                description.append(", ");
            }
            description.append(key).append('=').append(count);
        });
        return description.toString();
    }
}
