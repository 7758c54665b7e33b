package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.MapResult;
import com.contentlib.ingest.pipeline.reader.ReaderException;
import com.contentlib.ingest.pipeline.reader.ResilientReaderClient;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MapDiscoveryStrategy implements DiscoveryStrategy {
    private static final Logger log = LoggerFactory.getLogger(MapDiscoveryStrategy.class);

    private final ResilientReaderClient readerClient;
    private final DateExtractor dateExtractor;
    private final IngestProperties.MapEndpoint config;

    public MapDiscoveryStrategy(ResilientReaderClient readerClient, DateExtractor dateExtractor, IngestProperties properties) {
        this.readerClient = readerClient;
        this.dateExtractor = dateExtractor;
        this.config = properties.getDiscovery().getMap();
    }

    @Override
    public StrategyOutcome discover(String baseUrl, int maxUrls) {
        if (!config.isEnabled()) {
            return StrategyOutcome.empty("disabled");
        }
        if (!readerClient.isMapAvailable()) {
            return StrategyOutcome.empty("not_configured");
        }
        MapResult mapped;
        try {
            mapped = readerClient.map(baseUrl, config.limitFor(maxUrls), config.getExcludedPaths());
        } catch (ReaderException e) {
            log.warn("map discovery failed base={} code={} message={}", baseUrl, e.getCode(), e.getMessage());
            return StrategyOutcome.empty(e.getCode() + ": " + e.getMessage());
        }

        Map<String, DiscoveredUrl> posts = new LinkedHashMap<>();
        for (String link : mapped.links()) {
            String url = UrlUtils.canonicalize(link);
            if (url == null || posts.containsKey(url) || !UrlUtils.sameSite(url, baseUrl) || !UrlHeuristics.looksLikePost(url)) {
                continue;
            }
            posts.put(url, new DiscoveredUrl(
                url,
                UrlHeuristics.deriveTitleFromSlug(url),
                dateExtractor.fromUrl(url),
                UrlHeuristics.contentSection(url),
                UrlLanguageDetector.detect(url)
            ));
        }
        return StrategyOutcome.found(new ArrayList<>(posts.values()), mapped.creditsUsed(), null);
    }
}
