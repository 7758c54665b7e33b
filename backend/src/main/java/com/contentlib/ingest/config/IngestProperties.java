package com.contentlib.ingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "content-ingest/0.1 (+contact)";
    private static final String DEFAULT_BROWSER_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/124.0.0.0 Safari/537.36";

    private String userAgent;
    private String browserUserAgent;
    private int perHostDelayMs = 500;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private int perHostConcurrency = 2;
    private Discovery discovery = new Discovery();
    private Pagination pagination = new Pagination();
    private Validation validation = new Validation();
    private Reader reader = new Reader();
    private Fallback fallback = new Fallback();
    private Scrape scrape = new Scrape();
    private Robots robots = new Robots();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getBrowserUserAgent() {
        if (browserUserAgent == null || browserUserAgent.isBlank()) {
            return DEFAULT_BROWSER_USER_AGENT;
        }
        return browserUserAgent.trim();
    }

    public void setBrowserUserAgent(String browserUserAgent) {
        this.browserUserAgent = browserUserAgent;
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Reader getReader() {
        return reader;
    }

    public void setReader(Reader reader) {
        this.reader = reader;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public Scrape getScrape() {
        return scrape;
    }

    public void setScrape(Scrape scrape) {
        this.scrape = scrape;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Discovery {
        private int maxUrls = 100;
        private int maxUrlsLimit = 1000;
        private int minSitemapUrls = 5;
        private Sitemap sitemap = new Sitemap();
        private Rss rss = new Rss();
        private MapEndpoint map = new MapEndpoint();

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(1, maxUrls);
        }

        public int getMaxUrlsLimit() {
            return Math.max(getMaxUrls(), maxUrlsLimit);
        }

        public void setMaxUrlsLimit(int maxUrlsLimit) {
            this.maxUrlsLimit = maxUrlsLimit;
        }

        public int clampMaxUrls(Integer requested) {
            if (requested == null) {
                return getMaxUrls();
            }
            return Math.min(getMaxUrlsLimit(), Math.max(1, requested));
        }

        public int getMinSitemapUrls() {
            return Math.max(1, minSitemapUrls);
        }

        public void setMinSitemapUrls(int minSitemapUrls) {
            this.minSitemapUrls = Math.max(1, minSitemapUrls);
        }

        public Sitemap getSitemap() {
            return sitemap;
        }

        public void setSitemap(Sitemap sitemap) {
            this.sitemap = sitemap;
        }

        public Rss getRss() {
            return rss;
        }

        public void setRss(Rss rss) {
            this.rss = rss;
        }

        public MapEndpoint getMap() {
            return map;
        }

        public void setMap(MapEndpoint map) {
            this.map = map;
        }
    }

    public static class Sitemap {
        private int maxDepth = 2;
        private int maxChildSitemaps = 10;
        private int maxUrls = 500;

        public int getMaxDepth() {
            return Math.max(0, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMaxChildSitemaps() {
            return Math.max(1, maxChildSitemaps);
        }

        public void setMaxChildSitemaps(int maxChildSitemaps) {
            this.maxChildSitemaps = Math.max(1, maxChildSitemaps);
        }

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(1, maxUrls);
        }
    }

    public static class Rss {
        private int maxItems = 50;

        public int getMaxItems() {
            return Math.max(1, maxItems);
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = Math.max(1, maxItems);
        }
    }

    public static class MapEndpoint {
        private boolean enabled = true;
        private int limitMultiplier = 2;
        private int maxLimit = 5000;
        private List<String> excludedPaths = new ArrayList<>(List.of("/tag/*", "/category/*", "/author/*", "/page/*", "/search/*"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getLimitMultiplier() {
            return Math.max(1, limitMultiplier);
        }

        public void setLimitMultiplier(int limitMultiplier) {
            this.limitMultiplier = Math.max(1, limitMultiplier);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        public int limitFor(int maxUrls) {
            return (int) Math.min(getMaxLimit(), (long) Math.max(1, maxUrls) * getLimitMultiplier());
        }

        public List<String> getExcludedPaths() {
            return excludedPaths == null ? List.of() : List.copyOf(excludedPaths);
        }

        public void setExcludedPaths(List<String> excludedPaths) {
            this.excludedPaths = excludedPaths;
        }
    }

    public static class Pagination {
        private int maxPages = 50;
        private int zeroNewPageLimit = 2;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getZeroNewPageLimit() {
            return Math.max(1, zeroNewPageLimit);
        }

        public void setZeroNewPageLimit(int zeroNewPageLimit) {
            this.zeroNewPageLimit = Math.max(1, zeroNewPageLimit);
        }
    }

    public static class Validation {
        private boolean enabled = true;
        private int minWordCount = 100;
        private int concurrency = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinWordCount() {
            return Math.max(1, minWordCount);
        }

        public void setMinWordCount(int minWordCount) {
            this.minWordCount = Math.max(1, minWordCount);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }

    public static class Reader {
        private Provider jina = new Provider("https://r.jina.ai", 500, 3, 60);
        private Provider firecrawl = new Provider("https://api.firecrawl.dev", 1000, 2, 30);
        private Provider browser = new Provider("", 2000, 1, 120);
        private Breaker breaker = new Breaker();
        private Retry retry = new Retry();
        private Credits credits = new Credits();
        private boolean useLocationProxy = false;
        private String locationCountry = "US";

        public Provider getJina() {
            return jina;
        }

        public void setJina(Provider jina) {
            this.jina = jina;
        }

        public Provider getFirecrawl() {
            return firecrawl;
        }

        public void setFirecrawl(Provider firecrawl) {
            this.firecrawl = firecrawl;
        }

        public Provider getBrowser() {
            return browser;
        }

        public void setBrowser(Provider browser) {
            this.browser = browser;
        }

        public Breaker getBreaker() {
            return breaker;
        }

        public void setBreaker(Breaker breaker) {
            this.breaker = breaker;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }

        public Credits getCredits() {
            return credits;
        }

        public void setCredits(Credits credits) {
            this.credits = credits;
        }

        public boolean isUseLocationProxy() {
            return useLocationProxy;
        }

        public void setUseLocationProxy(boolean useLocationProxy) {
            this.useLocationProxy = useLocationProxy;
        }

        public String getLocationCountry() {
            return locationCountry;
        }

        public void setLocationCountry(String locationCountry) {
            this.locationCountry = locationCountry;
        }
    }

    public static class Provider {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;
        private int minDelayMs;
        private int concurrency;
        private int timeoutSeconds;

        public Provider() {
            this("", 1000, 1, 30);
        }

        public Provider(String baseUrl, int minDelayMs, int concurrency, int timeoutSeconds) {
            this.baseUrl = baseUrl;
            this.minDelayMs = minDelayMs;
            this.concurrency = concurrency;
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isConfigured() {
            return enabled && baseUrl != null && !baseUrl.isBlank();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(int minDelayMs) {
            this.minDelayMs = minDelayMs;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        // network calls stay within 10..120 seconds
        public int getTimeoutSeconds() {
            return Math.min(120, Math.max(10, timeoutSeconds));
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Breaker {
        private int threshold = 3;
        private long cooldownMs = 60_000;

        public int getThreshold() {
            return Math.max(1, threshold);
        }

        public void setThreshold(int threshold) {
            this.threshold = Math.max(1, threshold);
        }

        public long getCooldownMs() {
            return Math.max(1, cooldownMs);
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = Math.max(1, cooldownMs);
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 60_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Credits {
        private int limit = 500;
        private int warningThreshold = 400;

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }

        public int getWarningThreshold() {
            return Math.max(1, Math.min(warningThreshold, getLimit()));
        }

        public void setWarningThreshold(int warningThreshold) {
            this.warningThreshold = warningThreshold;
        }
    }

    public static class Fallback {
        private boolean enabled = true;
        private int domainFailureThreshold = 3;
        private int timeoutSeconds = 20;
        private int maxBytes = 5_000_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDomainFailureThreshold() {
            return Math.max(1, domainFailureThreshold);
        }

        public void setDomainFailureThreshold(int domainFailureThreshold) {
            this.domainFailureThreshold = Math.max(1, domainFailureThreshold);
        }

        public int getTimeoutSeconds() {
            return Math.min(120, Math.max(10, timeoutSeconds));
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxBytes() {
            return Math.max(1024, maxBytes);
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    public static class Scrape {
        private int maxUrls = 50;

        public int getMaxUrls() {
            return Math.max(1, maxUrls);
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = Math.max(1, maxUrls);
        }
    }

    public static class Robots {
        private boolean failOpen = true;
        private boolean respect = true;

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public boolean isRespect() {
            return respect;
        }

        public void setRespect(boolean respect) {
            this.respect = respect;
        }
    }

    public static class Cli {
        private boolean run;
        private String url = "";
        private String scope = "";
        private int maxUrls = 50;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getScope() {
            return scope;
        }

        public void setScope(String scope) {
            this.scope = scope;
        }

        public int getMaxUrls() {
            return maxUrls;
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
