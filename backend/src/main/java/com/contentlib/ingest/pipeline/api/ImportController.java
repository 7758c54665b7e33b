package com.contentlib.ingest.pipeline.api;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.dedup.DuplicateChecker;
import com.contentlib.ingest.pipeline.extract.ScrapeOrchestrator;
import com.contentlib.ingest.pipeline.extract.ScrapeProgressListener;
import com.contentlib.ingest.pipeline.model.DiscoveryOptions;
import com.contentlib.ingest.pipeline.model.DiscoveryReport;
import com.contentlib.ingest.pipeline.model.DuplicateCheckResult;
import com.contentlib.ingest.pipeline.model.ReaderStatus;
import com.contentlib.ingest.pipeline.model.ScrapeReport;
import com.contentlib.ingest.pipeline.reader.ResilientReaderClient;
import com.contentlib.ingest.pipeline.service.ContentDiscoveryService;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/import")
public class ImportController {
    private final ContentDiscoveryService discoveryService;
    private final DuplicateChecker duplicateChecker;
    private final ScrapeOrchestrator scrapeOrchestrator;
    private final ResilientReaderClient readerClient;
    private final IngestProperties properties;

    public ImportController(
        ContentDiscoveryService discoveryService,
        DuplicateChecker duplicateChecker,
        ScrapeOrchestrator scrapeOrchestrator,
        ResilientReaderClient readerClient,
        IngestProperties properties
    ) {
        this.discoveryService = discoveryService;
        this.duplicateChecker = duplicateChecker;
        this.scrapeOrchestrator = scrapeOrchestrator;
        this.readerClient = readerClient;
        this.properties = properties;
    }

    @PostMapping("/discover")
    public DiscoveryReport discover(@RequestBody DiscoverApiRequest request) {
        if (request == null || request.url() == null || !UrlUtils.isHttpUrl(normalizeInput(request.url()))) {
            throw new ResponseStatusException(BAD_REQUEST, "A valid http(s) url is required");
        }
        if (request.dateFrom() != null && request.dateTo() != null && request.dateFrom().isAfter(request.dateTo())) {
            throw new ResponseStatusException(BAD_REQUEST, "dateFrom must not be after dateTo");
        }
        int maxUrls = properties.getDiscovery().clampMaxUrls(request.maxUrls());
        DiscoveryOptions options = new DiscoveryOptions(
            maxUrls,
            request.maxPosts() == null ? null : Math.max(1, request.maxPosts()),
            request.dateFrom(),
            request.dateTo(),
            request.languages() == null ? List.of() : request.languages(),
            request.includeUndetected() == null || request.includeUndetected()
        );
        return discoveryService.discover(request.url(), options);
    }

    @PostMapping("/check-duplicates")
    public DuplicateCheckResult checkDuplicates(@RequestBody DuplicateCheckApiRequest request) {
        if (request == null || request.scope() == null || request.scope().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "scope is required");
        }
        return duplicateChecker.checkForDuplicates(
            request.urls() == null ? List.of() : request.urls(),
            request.scope().trim()
        );
    }

    @PostMapping("/scrape")
    public ScrapeReport scrape(@RequestBody ScrapeApiRequest request) {
        if (request == null || request.urls() == null || request.urls().isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "urls must not be empty");
        }
        int cap = properties.getScrape().getMaxUrls();
        if (request.urls().size() > cap) {
            throw new ResponseStatusException(BAD_REQUEST, "At most " + cap + " urls can be scraped per request");
        }
        List<String> invalid = new ArrayList<>();
        for (String url : request.urls()) {
            if (!UrlUtils.isHttpUrl(url)) {
                invalid.add(String.valueOf(url));
            }
        }
        if (!invalid.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid urls: " + invalid);
        }
        return scrapeOrchestrator.scrapeSelected(request.urls(), ScrapeProgressListener.NONE);
    }

    @GetMapping("/reader/status")
    public ReaderStatus readerStatus() {
        return readerClient.status();
    }

    private static String normalizeInput(String url) {
        String trimmed = url.trim();
        return trimmed.contains("://") ? trimmed : "https://" + trimmed;
    }
}
