package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.pipeline.util.UrlUtils;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UrlLanguageDetector {
    // language code -> other names used in subdomains and path prefixes, in detection order
    private static final Map<String, List<String>> LANGUAGES = new LinkedHashMap<>();
    private static final Pattern QUERY_LANGUAGE = Pattern.compile("(?:^|&)(?:lang|language|locale|hl)=([a-z]{2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern REGIONAL_SEGMENT = Pattern.compile("^([a-z]{2})[-_]([a-z]{2}|latam|hans|hant)$");

    static {
        LANGUAGES.put("en", List.of("eng", "english", "us", "uk"));
        LANGUAGES.put("de", List.of("ger", "german", "deutsch"));
        LANGUAGES.put("es", List.of("spa", "spanish", "espanol"));
        LANGUAGES.put("fr", List.of("fra", "fre", "french", "francais"));
        LANGUAGES.put("it", List.of("ita", "italian", "italiano"));
        LANGUAGES.put("pt", List.of("por", "portuguese", "portugues", "br"));
        LANGUAGES.put("nl", List.of("dut", "dutch", "nederlands"));
        LANGUAGES.put("ja", List.of("jp", "jpn", "japanese"));
        LANGUAGES.put("zh", List.of("cn", "chi", "chinese"));
        LANGUAGES.put("ko", List.of("kr", "kor", "korean"));
        LANGUAGES.put("ru", List.of("rus", "russian"));
        LANGUAGES.put("pl", List.of("pol", "polish", "polski"));
        LANGUAGES.put("sv", List.of("se", "swe", "swedish", "svenska"));
        LANGUAGES.put("no", List.of("nb", "nor", "norwegian", "norsk"));
        LANGUAGES.put("da", List.of("dk", "dan", "danish", "dansk"));
        LANGUAGES.put("fi", List.of("fin", "finnish", "suomi"));
        LANGUAGES.put("ar", List.of("ara", "arabic"));
        LANGUAGES.put("he", List.of("heb", "hebrew", "il"));
        LANGUAGES.put("tr", List.of("tur", "turkish", "turkce"));
        LANGUAGES.put("cs", List.of("cz", "czech", "cesky"));
        LANGUAGES.put("hu", List.of("hun", "hungarian", "magyar"));
    }

    private UrlLanguageDetector() {
    }

    public static String detect(String url) {
        URI uri = url == null ? null : UrlUtils.safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String subdomain = host.contains(".") ? host.substring(0, host.indexOf('.')) : "";
        if (subdomain.startsWith("www-")) {
            subdomain = subdomain.substring(4);
        }
        List<String> segments = UrlUtils.pathSegments(url);
        String firstSegment = segments.isEmpty() ? "" : segments.get(0).toLowerCase(Locale.ROOT);
        String query = uri.getRawQuery() == null ? "" : uri.getRawQuery();

        for (Map.Entry<String, List<String>> language : LANGUAGES.entrySet()) {
            if (matches(language.getKey(), language.getValue(), subdomain)
                || matches(language.getKey(), language.getValue(), firstSegment)
                || regional(language.getKey(), firstSegment)) {
                return language.getKey();
            }
        }
        Matcher queryMatch = QUERY_LANGUAGE.matcher(query);
        if (queryMatch.find()) {
            String code = queryMatch.group(1).toLowerCase(Locale.ROOT);
            if (LANGUAGES.containsKey(code)) {
                return code;
            }
        }
        return null;
    }

    public static List<String> supportedCodes() {
        return List.copyOf(LANGUAGES.keySet());
    }

    private static boolean matches(String code, List<String> aliases, String token) {
        return !token.isEmpty() && (token.equals(code) || aliases.contains(token));
    }

    private static boolean regional(String code, String segment) {
        Matcher matcher = REGIONAL_SEGMENT.matcher(segment);
        return matcher.matches() && matcher.group(1).equals(code);
    }
}
