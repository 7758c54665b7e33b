package com.contentlib.ingest.pipeline.validate;

import com.contentlib.ingest.pipeline.http.PoliteHttpClient;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.HttpFetchResult;
import com.contentlib.ingest.pipeline.model.PageValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class CandidateValidationService {
    private static final Logger log = LoggerFactory.getLogger(CandidateValidationService.class);

    private final PoliteHttpClient httpClient;
    private final PageValidator pageValidator;
    private final ExecutorService discoveryExecutor;

    public CandidateValidationService(
        PoliteHttpClient httpClient,
        PageValidator pageValidator,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        this.httpClient = httpClient;
        this.pageValidator = pageValidator;
        this.discoveryExecutor = discoveryExecutor;
    }

    public ValidationOutcome validateAll(List<DiscoveredUrl> candidates) {
        List<CompletableFuture<DiscoveredUrl>> futures = new ArrayList<>();
        for (DiscoveredUrl candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> validateOne(candidate), discoveryExecutor));
        }

        List<DiscoveredUrl> accepted = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < futures.size(); i++) {
            DiscoveredUrl candidate = candidates.get(i);
            try {
                DiscoveredUrl result = futures.get(i).join();
                if (result == null) {
                    rejected++;
                } else {
                    accepted.add(result);
                }
            } catch (CompletionException e) {
                log.warn("validation failed url={}, keeping candidate", candidate.url(), e.getCause());
                accepted.add(candidate);
            }
        }
        log.info("validation finished candidates={} accepted={} rejected={}", candidates.size(), accepted.size(), rejected);
        return new ValidationOutcome(accepted, rejected);
    }

    // null means rejected
    private DiscoveredUrl validateOne(DiscoveredUrl candidate) {
        HttpFetchResult fetch = httpClient.get(candidate.url(), PoliteHttpClient.HTML_ACCEPT);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.debug("validation fetch failed url={} reason={}", candidate.url(), fetch.describeFailure());
            return candidate;
        }
        PageValidation validation = pageValidator.validate(fetch.finalUrlOrRequested(), fetch.body());
        if (!validation.isArticle()) {
            log.debug("candidate rejected url={} reason={} types={}", candidate.url(), validation.reason(), validation.schemaTypes());
            return null;
        }
        return candidate.withTitleAndDate(validation.title(), validation.publishedDate());
    }

    public record ValidationOutcome(List<DiscoveredUrl> accepted, int rejectedCount) {
    }
}
