package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.DiscoveryMethod;
import com.contentlib.ingest.pipeline.model.DiscoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DiscoveryChain {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryChain.class);

    private final List<Step> steps;
    private final int minSitemapUrls;

    @Autowired
    public DiscoveryChain(
        SitemapDiscoveryStrategy sitemap,
        RssDiscoveryStrategy rss,
        MapDiscoveryStrategy map,
        IngestProperties properties
    ) {
        this(
            List.of(
                new Step(DiscoveryMethod.SITEMAP, sitemap),
                new Step(DiscoveryMethod.RSS, rss),
                new Step(DiscoveryMethod.MAP, map)
            ),
            properties.getDiscovery().getMinSitemapUrls()
        );
    }

    DiscoveryChain(List<Step> steps, int minSitemapUrls) {
        this.steps = List.copyOf(steps);
        this.minSitemapUrls = minSitemapUrls;
    }

    public DiscoveryResult discover(String baseUrl, int maxUrls) {
        return discover(baseUrl, maxUrls, LanguageFilter.ANY);
    }

    /**
     * Language filtering happens per step, so a strategy whose URLs are all in other languages
     * falls through like an empty one.
     */
    public DiscoveryResult discover(String baseUrl, int maxUrls, LanguageFilter languageFilter) {
        Map<DiscoveryMethod, DiscoveryStrategy.StrategyOutcome> outcomes = new HashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        int creditsUsed = 0;
        String targetSection = UrlHeuristics.targetSection(baseUrl);

        for (Step step : steps) {
            DiscoveryStrategy.StrategyOutcome outcome = run(step, baseUrl, maxUrls, outcomes, errors);
            creditsUsed += outcome.creditsUsed();
            List<DiscoveredUrl> urls = filter(step.method(), outcome, languageFilter, errors);
            if (urls.isEmpty()) {
                continue;
            }
            DiscoveryMethod method = step.method();
            int filteredOut = outcome.urls().size() - urls.size();

            if (method == DiscoveryMethod.SITEMAP && urls.size() < minSitemapUrls) {
                Step feedStep = stepFor(DiscoveryMethod.RSS);
                if (feedStep != null) {
                    DiscoveryStrategy.StrategyOutcome feed = run(feedStep, baseUrl, maxUrls, outcomes, errors);
                    creditsUsed += feed.creditsUsed();
                    List<DiscoveredUrl> feedUrls = filter(DiscoveryMethod.RSS, feed, languageFilter, errors);
                    if (feedUrls.size() > urls.size()) {
                        log.info("feed beat thin sitemap base={} sitemapUrls={} feedUrls={}", baseUrl, urls.size(), feedUrls.size());
                        method = DiscoveryMethod.RSS;
                        urls = feedUrls;
                        filteredOut = feed.urls().size() - feedUrls.size();
                    }
                }
            }

            List<DiscoveredUrl> selected = UrlHeuristics.prioritize(urls, targetSection, maxUrls);
            log.info("discovery chain finished base={} method={} urls={} credits={}", baseUrl, method.code(), selected.size(), creditsUsed);
            return new DiscoveryResult(selected, method, creditsUsed, false, Map.copyOf(errors), filteredOut);
        }

        log.info("discovery chain empty base={} credits={} errors={}", baseUrl, creditsUsed, errors);
        return DiscoveryResult.fallback(creditsUsed, Map.copyOf(errors));
    }

    // each strategy runs at most once per discovery, even when asked for a second opinion
    private DiscoveryStrategy.StrategyOutcome run(
        Step step,
        String baseUrl,
        int maxUrls,
        Map<DiscoveryMethod, DiscoveryStrategy.StrategyOutcome> outcomes,
        Map<String, String> errors
    ) {
        DiscoveryStrategy.StrategyOutcome cached = outcomes.get(step.method());
        if (cached != null) {
            return new DiscoveryStrategy.StrategyOutcome(cached.urls(), 0, cached.error());
        }
        DiscoveryStrategy.StrategyOutcome outcome;
        try {
            outcome = step.strategy().discover(baseUrl, maxUrls);
        } catch (RuntimeException e) {
            log.warn("discovery strategy failed base={} method={}", baseUrl, step.method().code(), e);
            outcome = DiscoveryStrategy.StrategyOutcome.empty(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (outcome.error() != null && !outcome.error().isBlank()) {
            errors.put(step.method().code(), outcome.error());
        }
        log.debug("discovery step base={} method={} urls={}", baseUrl, step.method().code(), outcome.urls().size());
        outcomes.put(step.method(), outcome);
        return outcome;
    }

    private List<DiscoveredUrl> filter(
        DiscoveryMethod method,
        DiscoveryStrategy.StrategyOutcome outcome,
        LanguageFilter languageFilter,
        Map<String, String> errors
    ) {
        List<DiscoveredUrl> kept = languageFilter.apply(outcome.urls());
        if (kept.isEmpty() && !outcome.urls().isEmpty()) {
            errors.putIfAbsent(method.code(), "language_filtered=" + outcome.urls().size());
        }
        return kept;
    }

    private Step stepFor(DiscoveryMethod method) {
        for (Step step : steps) {
            if (step.method() == method) {
                return step;
            }
        }
        return null;
    }

    record Step(DiscoveryMethod method, DiscoveryStrategy strategy) {
    }
}
