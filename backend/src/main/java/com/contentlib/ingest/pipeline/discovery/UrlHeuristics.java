package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.util.UrlUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class UrlHeuristics {
    private static final Set<String> CONTENT_SECTIONS = Set.of(
        "blog", "blogs", "article", "articles", "post", "posts", "news", "newsroom",
        "press", "press-releases", "announcements", "updates", "insights",
        "case-study", "case-studies", "casestudy", "casestudies", "customer-story",
        "customer-stories", "success-story", "success-stories", "use-case", "use-cases",
        "testimonial", "testimonials", "review", "reviews", "feedback",
        "help", "help-center", "helpcenter", "support", "docs", "documentation",
        "guide", "guides", "tutorial", "tutorials", "how-to", "howto", "faq", "faqs",
        "learn", "learning", "knowledge", "knowledge-base", "knowledgebase", "kb",
        "resource", "resources", "whitepaper", "whitepapers", "white-paper", "white-papers",
        "ebook", "ebooks", "report", "reports", "research", "library",
        "event", "events", "webinar", "webinars", "podcast", "podcasts", "video", "videos",
        "solutions", "products", "services", "features", "industries",
        "actualites", "noticias", "nachrichten", "nouvelles",
        "etudes-de-cas", "estudios-de-caso", "fallstudien", "temoignages", "ressources", "ressourcen"
    );

    private static final List<Pattern> EXCLUDED_PATHS = List.of(
        Pattern.compile("^/?(tag|tags|category|categories|author|authors|archive|archives)/?$"),
        Pattern.compile("^/?(search|login|logout|signin|signout|register|signup|account|profile)/?$"),
        Pattern.compile("^/?(cart|checkout|payment|order|orders)/?$"),
        Pattern.compile("^/?(privacy|privacy-policy|terms|legal|cookie|cookies|gdpr|imprint|impressum)/?$"),
        Pattern.compile("^/?(contact|about|team|careers|jobs|sitemap)/?$"),
        Pattern.compile("/(tag|tags|category|categories|author|authors|archive|archives)/"),
        Pattern.compile("/page[-_]?\\d+/?$"),
        Pattern.compile("/p/\\d+/?$"),
        Pattern.compile("/(feed|rss|atom|sitemap)(\\.xml)?/?$"),
        Pattern.compile("\\.(xml|json|txt|css|js)$"),
        Pattern.compile("\\.(jpg|jpeg|png|gif|svg|webp|pdf|doc|docx|xls|xlsx|ppt|pptx|zip|mp3|mp4)$"),
        Pattern.compile("^/(api|wp-admin|wp-content|wp-includes|wp-json)/")
    );
    private static final Pattern PAGE_QUERY = Pattern.compile("(^|&)(page|paged)=\\d+");
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("^\\d+$");
    private static final Pattern PAGE_N_SEGMENT = Pattern.compile("^page[-_]?\\d+$");
    private static final Pattern DATE_PATH = Pattern.compile("/\\d{4}/\\d{1,2}/|/\\d{4}-\\d{2}-\\d{2}/");
    private static final Pattern TRAILING_NUMBER = Pattern.compile("[-_]?\\d+$");
    private static final int MIN_ROOT_SLUG_LENGTH = 15;
    private static final int MIN_SLUG_LENGTH = 10;
    private static final int MIN_PLAIN_SEGMENT_LENGTH = 5;

    private UrlHeuristics() {
    }

    public static boolean isExcluded(String url) {
        String path = UrlUtils.path(url).toLowerCase(Locale.ROOT);
        for (Pattern pattern : EXCLUDED_PATHS) {
            if (pattern.matcher(path).find()) {
                return true;
            }
        }
        String query = UrlUtils.query(url);
        return query != null && PAGE_QUERY.matcher(query.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Section a URL lives under ({@code blog}, {@code case-studies}, ...), or null. Prefixed forms
     * such as {@code blog-archive} only count before the last segment.
     */
    public static String contentSection(String url) {
        List<String> segments = lowerSegments(url);
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            String normalized = TRAILING_NUMBER.matcher(segment).replaceAll("");
            if (CONTENT_SECTIONS.contains(normalized)) {
                return normalized;
            }
            if (i < segments.size() - 1) {
                for (String section : CONTENT_SECTIONS) {
                    if (segment.startsWith(section + "-") || segment.startsWith(section + "_")) {
                        return section;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Section a listing URL points at; unlike {@link #contentSection} the last segment counts.
     */
    public static String targetSection(String listingUrl) {
        for (String segment : lowerSegments(listingUrl)) {
            String normalized = TRAILING_NUMBER.matcher(segment).replaceAll("");
            if (CONTENT_SECTIONS.contains(normalized)) {
                return normalized;
            }
        }
        return null;
    }

    public static boolean looksLikePost(String url) {
        if (!UrlUtils.isHttpUrl(url) || isExcluded(url)) {
            return false;
        }
        List<String> segments = lowerSegments(url);
        if (segments.isEmpty()) {
            return false;
        }
        String last = segments.get(segments.size() - 1);
        if (NUMERIC_SEGMENT.matcher(last).matches() || PAGE_N_SEGMENT.matcher(last).matches()) {
            return false;
        }
        boolean longSlug = last.contains("-") && last.length() >= MIN_ROOT_SLUG_LENGTH;
        if (segments.size() == 1) {
            return longSlug;
        }
        if (CONTENT_SECTIONS.contains(last)) {
            return false;
        }
        boolean slug = last.contains("-") && last.length() > MIN_SLUG_LENGTH;
        boolean datedPath = DATE_PATH.matcher(UrlUtils.path(url) + "/").find();
        boolean underSection = contentSection(url) != null;
        return slug || datedPath || underSection || last.length() > MIN_PLAIN_SEGMENT_LENGTH;
    }

    /**
     * "/blog/ten-tips_for-writing" becomes "Ten Tips For Writing".
     */
    public static String deriveTitleFromSlug(String url) {
        String slug = UrlUtils.lastSegment(url);
        int dot = slug.lastIndexOf('.');
        if (dot > 0) {
            slug = slug.substring(0, dot);
        }
        String[] words = slug.replaceAll("[-_]+", " ").trim().split("\\s+");
        StringBuilder title = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.length() == 0 ? "Untitled Post" : title.toString();
    }

    /**
     * Stable reorder that puts candidates from {@code targetSection} first, then truncates.
     */
    public static List<DiscoveredUrl> prioritize(List<DiscoveredUrl> urls, String targetSection, int maxUrls) {
        List<DiscoveredUrl> ordered = new ArrayList<>(urls);
        if (targetSection != null) {
            ordered.sort(Comparator.comparingInt(url -> targetSection.equals(url.contentSection()) ? 0 : 1));
        }
        return ordered.size() > maxUrls ? List.copyOf(ordered.subList(0, maxUrls)) : List.copyOf(ordered);
    }

    private static List<String> lowerSegments(String url) {
        List<String> lowered = new ArrayList<>();
        for (String segment : UrlUtils.pathSegments(url)) {
            lowered.add(segment.toLowerCase(Locale.ROOT));
        }
        return lowered;
    }
}
