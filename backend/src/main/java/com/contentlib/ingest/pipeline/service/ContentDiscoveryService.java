package com.contentlib.ingest.pipeline.service;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.discovery.DiscoveryChain;
import com.contentlib.ingest.pipeline.discovery.LanguageFilter;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.DiscoveryMethod;
import com.contentlib.ingest.pipeline.model.DiscoveryOptions;
import com.contentlib.ingest.pipeline.model.DiscoveryReport;
import com.contentlib.ingest.pipeline.model.DiscoveryResult;
import com.contentlib.ingest.pipeline.pagination.PaginationWalker;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import com.contentlib.ingest.pipeline.validate.CandidateValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class ContentDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(ContentDiscoveryService.class);

    private final DiscoveryChain discoveryChain;
    private final PaginationWalker paginationWalker;
    private final CandidateValidationService validationService;
    private final IngestProperties properties;

    public ContentDiscoveryService(
        DiscoveryChain discoveryChain,
        PaginationWalker paginationWalker,
        CandidateValidationService validationService,
        IngestProperties properties
    ) {
        this.discoveryChain = discoveryChain;
        this.paginationWalker = paginationWalker;
        this.validationService = validationService;
        this.properties = properties;
    }

    public DiscoveryReport discover(String url, DiscoveryOptions options) {
        String baseUrl = UrlUtils.canonicalize(url);
        if (baseUrl == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        DiscoveryOptions opts = options == null
            ? DiscoveryOptions.defaults(properties.getDiscovery().getMaxUrls())
            : options;
        int maxUrls = properties.getDiscovery().clampMaxUrls(opts.maxUrls() > 0 ? opts.maxUrls() : null);

        LanguageFilter languageFilter = LanguageFilter.of(opts.languages(), opts.includeUndetected());
        DiscoveryResult chainResult = discoveryChain.discover(baseUrl, maxUrls, languageFilter);
        Map<String, String> errors = new LinkedHashMap<>(chainResult.errors());
        List<DiscoveredUrl> candidates = chainResult.urls();
        String method = chainResult.method().code();
        if (chainResult.fallbackRequired()) {
            Integer maxPosts = opts.maxPosts() == null ? Integer.valueOf(maxUrls) : opts.maxPosts();
            candidates = paginationWalker.walk(baseUrl, properties.getPagination().getMaxPages(), maxPosts);
            method = candidates.isEmpty() ? DiscoveryMethod.NONE.code() : DiscoveryMethod.PAGINATION.code();
            if (candidates.isEmpty()) {
                errors.put(DiscoveryMethod.PAGINATION.code(), "no_posts_found");
            }
        }
        int discoveredCount = candidates.size() + chainResult.filteredOut();

        // pagination output is unfiltered; chain output passes through unchanged
        List<DiscoveredUrl> inLanguage = languageFilter.apply(candidates);
        int filteredOut = chainResult.filteredOut() + candidates.size() - inLanguage.size();
        candidates = inLanguage;

        int rejected = 0;
        if (properties.getValidation().isEnabled() && !candidates.isEmpty()) {
            CandidateValidationService.ValidationOutcome outcome = validationService.validateAll(candidates);
            candidates = outcome.accepted();
            rejected = outcome.rejectedCount();
        }

        List<DiscoveredUrl> filtered = new ArrayList<>();
        for (DiscoveredUrl candidate : candidates) {
            if (matchesDateRange(candidate, opts.dateFrom(), opts.dateTo())) {
                filtered.add(candidate);
            }
        }
        filteredOut += candidates.size() - filtered.size();

        Set<String> sections = new LinkedHashSet<>();
        Set<String> languages = new LinkedHashSet<>();
        for (DiscoveredUrl item : filtered) {
            if (item.contentSection() != null) {
                sections.add(item.contentSection());
            }
            if (item.language() != null) {
                languages.add(item.language());
            }
        }

        log.info(
            "discovery finished base={} method={} urls={} credits={} rejected={} filtered={}",
            baseUrl,
            method,
            filtered.size(),
            chainResult.creditsUsed(),
            rejected,
            filteredOut
        );
        return new DiscoveryReport(
            baseUrl,
            List.copyOf(filtered),
            method,
            chainResult.creditsUsed(),
            discoveredCount,
            rejected,
            filteredOut,
            List.copyOf(sections),
            List.copyOf(languages),
            Map.copyOf(errors)
        );
    }

    static boolean matchesDateRange(DiscoveredUrl item, LocalDate from, LocalDate to) {
        LocalDate published = item.publishedDate();
        if (published == null) {
            return true;
        }
        if (from != null && published.isBefore(from)) {
            return false;
        }
        return to == null || !published.isAfter(to);
    }
}
