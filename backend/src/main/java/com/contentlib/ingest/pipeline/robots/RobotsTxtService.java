package com.contentlib.ingest.pipeline.robots;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final int MAX_ROBOTS_BYTES = 512_000;

    private final IngestProperties properties;
    private final PoliteHttpClient httpClient;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(IngestProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public RobotsRules getRules(String anyUrlOnSite) {
        String origin = UrlUtils.origin(anyUrlOnSite);
        if (origin == null) {
            return RobotsRules.allowAll();
        }
        return cache.computeIfAbsent(origin.toLowerCase(Locale.ROOT), this::loadRules);
    }

    public boolean isAllowed(String url) {
        if (!properties.getRobots().isRespect()) {
            return true;
        }
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return getRules(url).isAllowed(path);
    }

    public List<String> sitemapHints(String baseUrl) {
        return getRules(baseUrl).getSitemapUrls();
    }

    private RobotsRules loadRules(String origin) {
        HttpFetchResult fetch = httpClient.get(origin + "/robots.txt", "text/plain,text/*;q=0.9,*/*;q=0.1", MAX_ROBOTS_BYTES);
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getRobots().isFailOpen() || fetch.statusCode() == 404;
            log.debug(
                "robots unavailable origin={} status={} errorCode={} decision={}",
                origin,
                fetch.statusCode(),
                fetch.errorCode(),
                failOpen ? "allow_all" : "disallow_all"
            );
            return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body(), agentToken());
        log.debug("loaded robots origin={} sitemapHints={}", origin, rules.getSitemapUrls().size());
        return rules;
    }

    private String agentToken() {
        String userAgent = properties.getUserAgent();
        int slash = userAgent.indexOf('/');
        return (slash > 0 ? userAgent.substring(0, slash) : userAgent).trim();
    }
}
