package com.contentlib.ingest.pipeline.pagination;

import com.contentlib.ingest.pipeline.discovery.UrlHeuristics;
import com.contentlib.ingest.pipeline.discovery.UrlLanguageDetector;
import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.ListingPage;
import com.contentlib.ingest.pipeline.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class ListingPageParser {
    static final int MIN_TITLE_CHARS = 10;

    private static final List<String> POST_LINK_SELECTORS = List.of(
        "article a[href]",
        ".blog-post a[href]",
        ".post a[href]",
        "a[href*=/blog/]",
        "a[href*=/post/]",
        "a[href*=/article/]",
        ".entry-title a[href]",
        "h2 a[href]",
        "h3 a[href]",
        ".card a[href]",
        "[class*=blog] a[href]",
        "[class*=post] a[href]"
    );
    private static final String PAGINATION_SELECTOR = String.join(", ",
        "a[rel=next]",
        "link[rel=next]",
        ".pagination a[href]",
        ".pager a[href]",
        ".nav-links a[href]",
        "a.next[href]",
        ".next a[href]",
        "a[href*=?page=]",
        "a[href*=&page=]",
        "a[href*=paged=]",
        "a[href*=/page/]"
    );
    // directories whose children are not posts, unless the listing itself lives there
    private static final Set<String> NON_POST_SECTIONS = Set.of(
        "category", "categories", "tag", "tags", "author", "authors", "page", "pages", "archive", "archives",
        "solutions", "products", "product", "services", "service", "industries", "industry", "company", "team",
        "careers", "career", "jobs", "job", "pricing", "demo", "demos", "download", "downloads", "resources",
        "resource", "library", "whitepaper", "whitepapers", "webinar", "webinars", "video", "videos", "news",
        "publication", "publications", "customer-story", "customer-stories", "case-study", "case-studies",
        "brochure", "brochures"
    );
    private static final Set<String> UTILITY_SEGMENTS = Set.of(
        "search", "sitemap", "sitemap.xml", "robots.txt", "feed", "rss", "atom", "contact", "contact-us", "about",
        "about-us", "privacy", "privacy-policy", "terms", "legal", "subscribe", "newsletter", "login", "register",
        "signup", "sign-up", "sign-in", "pricing", "demo", "wp-admin", "wp-content", "wp-includes", ".well-known"
    );
    private static final Set<String> FILTER_PARAMS = Set.of(
        "category", "tag", "author", "page", "paged", "search", "s", "filter", "sort", "orderby", "order"
    );
    private static final Pattern MEDIA_EXTENSION = Pattern.compile(
        "\\.(jpg|jpeg|png|gif|webp|svg|ico|bmp|tiff|pdf|mp4|mp3|avi|mov|wmv|zip|rar|exe|dmg)$"
    );
    private static final Pattern DATE_ARCHIVE = Pattern.compile("^/\\d{4}(/\\d{2})?/?$");
    private static final Pattern PAGE_LINK = Pattern.compile("([?&](page|paged)=\\d+)|(/page/\\d+/?$)");

    private final DateExtractor dateExtractor;

    public ListingPageParser(DateExtractor dateExtractor) {
        this.dateExtractor = dateExtractor;
    }

    public ListingPage parse(String html, String pageUrl, String listingUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
        String listingPath = UrlUtils.path(UrlUtils.canonicalize(listingUrl)).toLowerCase(Locale.ROOT);

        Map<String, DiscoveredUrl> posts = new LinkedHashMap<>();
        for (String selector : POST_LINK_SELECTORS) {
            for (Element link : document.select(selector)) {
                String href = link.absUrl("href");
                if (href.isBlank() || href.contains("#")) {
                    continue;
                }
                String url = UrlUtils.canonicalize(href);
                if (url == null || posts.containsKey(url) || isExcluded(url, listingUrl, listingPath)) {
                    continue;
                }
                String title = linkTitle(link);
                if (title == null || title.length() < MIN_TITLE_CHARS) {
                    continue;
                }
                posts.put(url, new DiscoveredUrl(
                    url,
                    title,
                    nearbyDate(link, url),
                    UrlHeuristics.contentSection(url),
                    UrlLanguageDetector.detect(url)
                ));
            }
        }

        LinkedHashSet<String> pagination = new LinkedHashSet<>();
        for (Element link : document.select(PAGINATION_SELECTOR)) {
            String url = UrlUtils.canonicalize(link.absUrl("href"));
            if (url == null || !UrlUtils.sameSite(url, listingUrl) || posts.containsKey(url)) {
                continue;
            }
            boolean explicitNext = "next".equalsIgnoreCase(link.attr("rel")) || link.hasClass("next");
            if (explicitNext || PAGE_LINK.matcher(url).find() || isPaginationContainer(link)) {
                pagination.add(url);
            }
        }
        return new ListingPage(new ArrayList<>(posts.values()), new ArrayList<>(pagination));
    }

    boolean isExcluded(String url, String listingUrl, String listingPath) {
        String host = UrlUtils.hostOf(url);
        if (host == null || !UrlUtils.sameSite(url, listingUrl)) {
            return true;
        }
        if (host.contains("cdn.") || host.contains("static.") || host.contains("assets.")) {
            return true;
        }
        String path = UrlUtils.path(url).toLowerCase(Locale.ROOT);
        if (path.equals(listingPath) || path.equals("/") || MEDIA_EXTENSION.matcher(path).find() || DATE_ARCHIVE.matcher(path).matches()) {
            return true;
        }
        String query = UrlUtils.query(url);
        if (query != null) {
            for (String pair : query.split("&")) {
                String name = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
                if (FILTER_PARAMS.contains(name.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        List<String> segments = UrlUtils.pathSegments(url);
        List<String> listingSegments = UrlUtils.pathSegments(listingUrl);
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i).toLowerCase(Locale.ROOT);
            if (UTILITY_SEGMENTS.contains(segment)) {
                return true;
            }
            boolean listedSection = i < listingSegments.size() && listingSegments.get(i).equalsIgnoreCase(segment);
            if (i < segments.size() - 1 && NON_POST_SECTIONS.contains(segment) && !listedSection) {
                return true;
            }
        }
        return segments.isEmpty() || (segments.size() == 1 && segments.get(0).length() < 5);
    }

    private String linkTitle(Element link) {
        String title = link.text().trim();
        if (title.length() >= MIN_TITLE_CHARS) {
            return title;
        }
        Element container = link.closest("article, .post, .blog-post, .card");
        if (container != null) {
            Element heading = container.selectFirst("h1, h2, h3, .title, .entry-title");
            if (heading != null && !heading.text().isBlank()) {
                return heading.text().trim();
            }
        }
        String label = link.attr("title").trim();
        return label.isEmpty() ? title : label;
    }

    private LocalDate nearbyDate(Element link, String url) {
        Element container = link.closest("article, .post, .blog-post, .card, li");
        if (container != null) {
            Element time = container.selectFirst("time[datetime]");
            if (time != null) {
                LocalDate date = dateExtractor.parse(time.attr("datetime"));
                if (date != null) {
                    return date;
                }
            }
        }
        return dateExtractor.fromUrl(url);
    }

    private boolean isPaginationContainer(Element link) {
        return link.closest(".pagination, .pager, .nav-links") != null;
    }
}
