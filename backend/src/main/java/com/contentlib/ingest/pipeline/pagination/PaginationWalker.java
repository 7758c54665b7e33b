package com.contentlib.ingest.pipeline.pagination;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.ListingPage;
import com.contentlib.ingest.pipeline.model.ReaderResponse;
import com.contentlib.ingest.pipeline.reader.ReaderException;
import com.contentlib.ingest.pipeline.reader.ResilientReaderClient;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class PaginationWalker {
    private static final Logger log = LoggerFactory.getLogger(PaginationWalker.class);
    private static final Pattern QUERY_PAGE = Pattern.compile("[?&](page|paged)=(\\d+)");
    private static final Pattern PATH_PAGE = Pattern.compile("/page/(\\d+)/?$");
    static final int MAX_PAGE_NUMBER = 100_000;

    private final ResilientReaderClient readerClient;
    private final ListingPageParser parser;
    private final int defaultMaxPages;
    private final int zeroNewPageLimit;

    public PaginationWalker(ResilientReaderClient readerClient, ListingPageParser parser, IngestProperties properties) {
        this.readerClient = readerClient;
        this.parser = parser;
        this.defaultMaxPages = properties.getPagination().getMaxPages();
        this.zeroNewPageLimit = properties.getPagination().getZeroNewPageLimit();
    }

    public List<DiscoveredUrl> walk(String startUrl) {
        return walk(startUrl, defaultMaxPages, null);
    }

    public List<DiscoveredUrl> walk(String startUrl, int maxPages, Integer maxPosts) {
        Walk walk = new Walk(UrlUtils.canonicalize(startUrl), Math.max(1, maxPages), maxPosts);
        walk.run();
        log.info(
            "pagination walk finished start={} pages={} posts={} stop={}",
            startUrl,
            walk.pagesFetched,
            walk.posts.size(),
            walk.stopReason
        );
        return List.copyOf(walk.posts.values());
    }

    enum PageScheme {
        QUERY_PAGE,
        PATH_PAGE,
        QUERY_PAGED;

        String apply(String url, int page) {
            String base = stripPageMarker(url);
            return switch (this) {
                case QUERY_PAGE -> base + (base.contains("?") ? "&" : "?") + "page=" + page;
                case PATH_PAGE -> {
                    int query = base.indexOf('?');
                    String path = query < 0 ? base : base.substring(0, query);
                    String rest = query < 0 ? "" : base.substring(query);
                    yield (path.endsWith("/") ? path : path + "/") + "page/" + page + rest;
                }
                case QUERY_PAGED -> base + (base.contains("?") ? "&" : "?") + "paged=" + page;
            };
        }
    }

    static int currentPageNumber(String url) {
        Matcher query = QUERY_PAGE.matcher(url);
        if (query.find()) {
            return pageNumber(query.group(2));
        }
        Matcher path = PATH_PAGE.matcher(UrlUtils.path(url));
        if (path.find()) {
            return pageNumber(path.group(1));
        }
        return 1;
    }

    // Page numbers past the ceiling are treated as unreadable.
    private static int pageNumber(String digits) {
        if (digits.length() > String.valueOf(MAX_PAGE_NUMBER).length()) {
            return 1;
        }
        int number = Integer.parseInt(digits);
        return number > MAX_PAGE_NUMBER ? 1 : number;
    }

    static String stripPageMarker(String url) {
        String stripped = url.replaceAll("([?&])(page|paged)=\\d+&?", "$1");
        if (stripped.endsWith("?") || stripped.endsWith("&")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped.replaceAll("/page/\\d+/?(?=$|\\?)", "");
    }

    private final class Walk {
        private final String listingUrl;
        private final int maxPages;
        private final Integer maxPosts;
        private final ArrayDeque<String> queue = new ArrayDeque<>();
        private final Set<String> visited = new HashSet<>();
        private final Map<String, DiscoveredUrl> posts = new LinkedHashMap<>();
        private int pagesFetched;
        private int zeroNewRun;
        private PageScheme rememberedScheme;
        private String guessedUrl;
        private ListingPage guessed;
        private String stopReason = "exhausted";

        private Walk(String listingUrl, int maxPages, Integer maxPosts) {
            this.listingUrl = listingUrl;
            this.maxPages = maxPages;
            this.maxPosts = maxPosts;
        }

        private void run() {
            if (listingUrl == null) {
                stopReason = "invalid_url";
                return;
            }
            queue.add(listingUrl);
            while (true) {
                String pageUrl;
                ListingPage page;
                if (guessed != null) {
                    pageUrl = guessedUrl;
                    page = guessed;
                    guessed = null;
                } else {
                    if (queue.isEmpty()) {
                        return;
                    }
                    if (pagesFetched >= maxPages) {
                        stopReason = "max_pages";
                        return;
                    }
                    pageUrl = queue.poll();
                    if (visited.contains(pageUrl)) {
                        continue;
                    }
                    page = fetch(pageUrl);
                }

                int added = page == null ? 0 : collect(page);
                if (postCapReached()) {
                    stopReason = "max_posts";
                    return;
                }
                if (added == 0) {
                    if (!countZeroNewPage()) {
                        return;
                    }
                } else {
                    zeroNewRun = 0;
                }
                if (page == null) {
                    continue;
                }

                int enqueued = 0;
                for (String link : page.paginationLinks()) {
                    if (!visited.contains(link) && !queue.contains(link)) {
                        queue.add(link);
                        enqueued++;
                    }
                }
                if (added > 0 && enqueued == 0 && queue.isEmpty() && !tryNextPageScheme(pageUrl)) {
                    return;
                }
            }
        }

        /**
         * Guesses the next page with each page-number scheme until one returns unseen posts. That
         * page is handed back to the main loop; a round where no scheme works counts as one page
         * without new posts. Returns false when the walk must stop.
         */
        private boolean tryNextPageScheme(String currentUrl) {
            int current = currentPageNumber(currentUrl);
            if (current >= MAX_PAGE_NUMBER) {
                stopReason = "page_number_limit";
                return false;
            }
            int next = current + 1;
            List<PageScheme> schemes = rememberedScheme != null ? List.of(rememberedScheme) : List.of(PageScheme.values());
            for (PageScheme scheme : schemes) {
                if (pagesFetched >= maxPages) {
                    stopReason = "max_pages";
                    return false;
                }
                String candidate = UrlUtils.canonicalize(scheme.apply(currentUrl, next));
                if (candidate == null || visited.contains(candidate)) {
                    continue;
                }
                ListingPage page = fetch(candidate);
                if (page != null && hasUnseenPosts(page)) {
                    rememberedScheme = scheme;
                    guessedUrl = candidate;
                    guessed = page;
                    return true;
                }
            }
            return countZeroNewPage();
        }

        private boolean countZeroNewPage() {
            zeroNewRun++;
            if (zeroNewRun >= zeroNewPageLimit) {
                stopReason = "no_new_posts";
                return false;
            }
            return true;
        }

        private boolean hasUnseenPosts(ListingPage page) {
            for (DiscoveredUrl post : page.posts()) {
                if (!posts.containsKey(post.url()) && !visited.contains(post.url())) {
                    return true;
                }
            }
            return false;
        }

        private ListingPage fetch(String pageUrl) {
            visited.add(pageUrl);
            pagesFetched++;
            try {
                ReaderResponse response = readerClient.fetchListing(pageUrl);
                return parser.parse(response.content(), pageUrl, listingUrl);
            } catch (ReaderException e) {
                log.debug("listing page fetch failed url={} code={}", pageUrl, e.getCode());
                return null;
            }
        }

        private int collect(ListingPage page) {
            int added = 0;
            for (DiscoveredUrl post : page.posts()) {
                if (postCapReached()) {
                    break;
                }
                if (!visited.contains(post.url()) && posts.putIfAbsent(post.url(), post) == null) {
                    added++;
                }
            }
            return added;
        }

        private boolean postCapReached() {
            return maxPosts != null && posts.size() >= maxPosts;
        }
    }
}
