package com.contentlib.ingest.pipeline.reader;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.http.DomainFailureTracker;
import com.contentlib.ingest.pipeline.model.MapResult;
import com.contentlib.ingest.pipeline.model.ReaderFormat;
import com.contentlib.ingest.pipeline.model.ReaderRequest;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.contentlib.ingest.pipeline.model.ReaderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every external content fetch. Configured providers are tried in order, each
 * behind its own channel; when all of them fail the page is fetched directly with browser headers.
 */
@Service
public class ResilientReaderClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientReaderClient.class);

    private final List<ProviderChannel> contentChannels;
    private final ProviderChannel browserChannel;
    private final FirecrawlProvider mapProvider;
    private final ProviderChannel mapChannel;
    private final DirectFetchFallback directFetch;
    private final CreditLedger creditLedger;
    private final DomainFailureTracker domainFailureTracker;
    private final boolean fallbackEnabled;
    private final boolean useLocationProxy;

    @Autowired
    public ResilientReaderClient(
        IngestProperties properties,
        JinaReaderProvider jina,
        FirecrawlProvider firecrawl,
        HeadlessBrowserProvider browser,
        DirectFetchFallback directFetch,
        DomainFailureTracker domainFailureTracker,
        Clock clock,
        Sleeper sleeper
    ) {
        IngestProperties.Reader reader = properties.getReader();
        this.creditLedger = new CreditLedger(reader.getCredits());
        ProviderChannel jinaChannel = ProviderChannel.create(jina, reader.getJina(), reader, creditLedger, clock, sleeper);
        ProviderChannel firecrawlChannel = ProviderChannel.create(firecrawl, reader.getFirecrawl(), reader, creditLedger, clock, sleeper);
        this.contentChannels = List.of(jinaChannel, firecrawlChannel);
        this.browserChannel = ProviderChannel.create(browser, reader.getBrowser(), reader, creditLedger, clock, sleeper);
        this.mapProvider = firecrawl;
        this.mapChannel = firecrawlChannel;
        this.directFetch = directFetch;
        this.domainFailureTracker = domainFailureTracker;
        this.fallbackEnabled = properties.getFallback().isEnabled();
        this.useLocationProxy = reader.isUseLocationProxy();
    }

    ResilientReaderClient(
        List<ProviderChannel> contentChannels,
        ProviderChannel browserChannel,
        DirectFetchFallback directFetch,
        CreditLedger creditLedger,
        DomainFailureTracker domainFailureTracker,
        boolean fallbackEnabled
    ) {
        this.contentChannels = List.copyOf(contentChannels);
        this.browserChannel = browserChannel;
        this.mapProvider = null;
        this.mapChannel = null;
        this.directFetch = directFetch;
        this.creditLedger = creditLedger;
        this.domainFailureTracker = domainFailureTracker;
        this.fallbackEnabled = fallbackEnabled;
        this.useLocationProxy = false;
    }

    /**
     * Fetches article content. Fails with {@link ReaderConfigurationException} when no provider is
     * configured at all; otherwise the direct fetch is the final fallback.
     */
    public ReaderResponse fetch(String url, ReaderFormat format) {
        requireConfigured();
        ReaderRequest request = new ReaderRequest(url, format, useLocationProxy);
        ReaderException lastError = null;
        for (ProviderChannel channel : contentChannels) {
            if (!channel.isConfigured()) {
                continue;
            }
            try {
                return channel.fetch(request);
            } catch (ReaderException e) {
                log.warn("reader fetch failed provider={} url={} code={} message={}", channel.name(), url, e.getCode(), e.getMessage());
                lastError = e;
            }
        }
        return fallBackToDirect(url, format, lastError);
    }

    /**
     * Fetches a listing page as HTML. Unlike {@link #fetch} this works without any provider: the
     * direct fetch is tried after the providers and the headless browser last.
     */
    public ReaderResponse fetchListing(String url) {
        ReaderRequest request = new ReaderRequest(url, ReaderFormat.HTML, false);
        ReaderException lastError = null;
        for (ProviderChannel channel : contentChannels) {
            if (!channel.isConfigured()) {
                continue;
            }
            try {
                return channel.fetch(request);
            } catch (ReaderException e) {
                log.debug("listing fetch failed provider={} url={} code={}", channel.name(), url, e.getCode());
                lastError = e;
            }
        }
        if (fallbackEnabled) {
            try {
                return directFetch.fetch(url, ReaderFormat.HTML);
            } catch (ReaderException e) {
                log.debug("listing direct fetch failed url={} code={}", url, e.getCode());
                lastError = e;
            }
        }
        if (browserChannel != null && browserChannel.isConfigured()) {
            try {
                return browserChannel.fetch(request);
            } catch (ReaderException e) {
                lastError = e;
            }
        }
        if (lastError == null) {
            throw new ReaderConfigurationException("reader", "no listing fetcher available for " + url);
        }
        throw lastError;
    }

    public boolean isMapAvailable() {
        return mapProvider != null && mapChannel != null && mapChannel.isConfigured();
    }

    public MapResult map(String baseUrl, int limit, List<String> excludedPaths) {
        if (!isMapAvailable()) {
            throw new ReaderConfigurationException(FirecrawlProvider.NAME, "map endpoint is not configured");
        }
        ReaderRequest request = new ReaderRequest(baseUrl, ReaderFormat.HTML, false);
        return mapChannel.execute(
            request,
            r -> mapProvider.map(r.url(), limit, excludedPaths),
            MapResult::creditsUsed,
            1
        );
    }

    public boolean isConfigured() {
        for (ProviderChannel channel : contentChannels) {
            if (channel.isConfigured()) {
                return true;
            }
        }
        return false;
    }

    public void requireConfigured() {
        if (!isConfigured()) {
            throw new ReaderConfigurationException("reader", "no reader provider is configured; set a jina or firecrawl api key");
        }
    }

    public ReaderStatus status() {
        List<ReaderStatus.Channel> channels = new ArrayList<>();
        for (ProviderChannel channel : contentChannels) {
            channels.add(channel.snapshot());
        }
        if (browserChannel != null) {
            channels.add(browserChannel.snapshot());
        }
        return new ReaderStatus(channels, creditLedger.snapshot(), domainFailureTracker.suppressedDomains());
    }

    private ReaderResponse fallBackToDirect(String url, ReaderFormat format, ReaderException lastError) {
        if (!fallbackEnabled) {
            throw lastError;
        }
        try {
            ReaderResponse response = directFetch.fetch(url, format);
            log.info("direct fetch fallback succeeded url={}", url);
            return response;
        } catch (ReaderException e) {
            log.warn("direct fetch fallback failed url={} code={} message={}", url, e.getCode(), e.getMessage());
            if (lastError == null) {
                throw e;
            }
            lastError.addSuppressed(e);
            throw lastError;
        }
    }
}
