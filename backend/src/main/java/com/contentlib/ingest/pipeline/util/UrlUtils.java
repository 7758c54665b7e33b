package com.contentlib.ingest.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Canonical absolute form used as the identity of a discovered page: lower-case scheme and host,
     * no fragment, no tracking parameters, no trailing slash except for the root path.
     */
    public static String canonicalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String value = candidate.trim();
        if (value.startsWith("//")) {
            value = "https:" + value;
        } else if (!value.contains("://")) {
            value = "https://" + value;
        }
        URI uri = safeUri(value);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = stripTrackingParams(uri.getRawQuery());
        StringBuilder out = new StringBuilder(scheme).append("://").append(host);
        if (uri.getPort() > 0 && !isDefaultPort(scheme, uri.getPort())) {
            out.append(':').append(uri.getPort());
        }
        out.append(path);
        if (query != null && !query.isBlank()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static boolean isHttpUrl(String candidate) {
        URI uri = candidate == null ? null : safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    public static String hostOf(String url) {
        URI uri = url == null ? null : safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static String rootDomain(String host) {
        if (host == null) {
            return null;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        return normalized.startsWith("www.") ? normalized.substring(4) : normalized;
    }

    public static boolean sameSite(String url, String baseUrl) {
        String a = rootDomain(hostOf(url));
        String b = rootDomain(hostOf(baseUrl));
        return a != null && a.equals(b);
    }

    public static String origin(String url) {
        URI uri = url == null ? null : safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String port = uri.getPort() > 0 && !isDefaultPort(scheme, uri.getPort()) ? ":" + uri.getPort() : "";
        return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + port;
    }

    public static String path(String url) {
        URI uri = url == null ? null : safeUri(url.trim());
        if (uri == null || uri.getRawPath() == null || uri.getRawPath().isBlank()) {
            return "/";
        }
        return uri.getRawPath();
    }

    public static String query(String url) {
        URI uri = url == null ? null : safeUri(url.trim());
        return uri == null ? null : uri.getRawQuery();
    }

    public static List<String> pathSegments(String url) {
        return Arrays.stream(path(url).split("/"))
            .filter(segment -> !segment.isBlank())
            .collect(Collectors.toList());
    }

    public static String lastSegment(String url) {
        List<String> segments = pathSegments(url);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public static String resolve(String baseUrl, String relative) {
        if (relative == null || relative.isBlank()) {
            return null;
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return null;
        }
        try {
            return base.resolve(relative.trim()).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            String name = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("utm_") || lower.equals("fbclid") || lower.equals("gclid") || lower.equals("ref")) {
                continue;
            }
            if (!pair.isBlank()) {
                kept.add(pair);
            }
        }
        return String.join("&", kept);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("https".equals(scheme) && port == 443) || ("http".equals(scheme) && port == 80);
    }
}
