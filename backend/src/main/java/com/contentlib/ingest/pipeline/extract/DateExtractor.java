package com.contentlib.ingest.pipeline.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class DateExtractor {
    private static final int TEXT_SCAN_CHARS = 2000;
    private static final int TEXT_YEAR_WINDOW = 10;

    static final List<String> DATE_META_KEYS = List.of(
        "article:published_time",
        "og:article:published_time",
        "publishedtime",
        "published_time",
        "datepublished",
        "date",
        "pubdate",
        "publishdate",
        "dc.date",
        "dc.date.issued",
        "sailthru.date",
        "parsely-pub-date",
        "created",
        "createdat",
        "article:modified_time",
        "modifiedtime"
    );

    private static final List<String> JSON_LD_DATE_FIELDS = List.of("datePublished", "dateCreated", "uploadDate");

    private static final String MONTHS =
        "(Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)";
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTHS + "\\.?,?\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile("\\b" + MONTHS + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern US_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");

    private static final Pattern URL_YMD_SLASHED = Pattern.compile("/((?:19|20)\\d{2})/(\\d{1,2})/(\\d{1,2})(?:/|$)");
    private static final Pattern URL_YMD_DASHED = Pattern.compile("/((?:19|20)\\d{2})-(\\d{2})-(\\d{2})(?:[/-]|$)");
    private static final Pattern URL_YMD_COMPACT = Pattern.compile("/((?:19|20)\\d{2})(\\d{2})(\\d{2})(?:/|$)");
    private static final Pattern URL_YM = Pattern.compile("/((?:19|20)\\d{2})/(\\d{1,2})(?:/|$)");

    private final JsonLdParser jsonLdParser;
    private final Clock clock;

    public DateExtractor(JsonLdParser jsonLdParser, Clock clock) {
        this.jsonLdParser = jsonLdParser;
        this.clock = clock;
    }

    public LocalDate fromHtml(String html, String url) {
        if (html == null || html.isBlank()) {
            return fromUrl(url);
        }
        return fromDocument(Jsoup.parse(html, url == null ? "" : url), url);
    }

    public LocalDate fromDocument(Document document, String url) {
        LocalDate meta = fromMetaTags(document);
        if (meta != null) {
            return meta;
        }
        LocalDate structured = fromJsonLd(document);
        if (structured != null) {
            return structured;
        }
        LocalDate visible = document.body() == null ? null : fromText(document.body().text());
        if (visible != null) {
            return visible;
        }
        return fromUrl(url);
    }

    /**
     * Variant for already extracted content, where provider metadata stands in for meta tags.
     */
    public LocalDate fromContent(String content, Map<String, String> metadata, String url) {
        LocalDate meta = fromMetadata(metadata);
        if (meta != null) {
            return meta;
        }
        LocalDate visible = fromText(content);
        if (visible != null) {
            return visible;
        }
        return fromUrl(url);
    }

    public LocalDate fromMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        Map<String, String> lowered = new HashMap<>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                lowered.putIfAbsent(key.toLowerCase(Locale.ROOT), value);
            }
        });
        for (String key : DATE_META_KEYS) {
            LocalDate date = plausible(parseLenient(lowered.get(key)));
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    public LocalDate fromMetaTags(Document document) {
        for (String key : DATE_META_KEYS) {
            for (Element meta : document.select("meta[property], meta[name], meta[itemprop]")) {
                String name = firstNonBlank(meta.attr("property"), meta.attr("name"), meta.attr("itemprop"));
                if (name == null || !name.toLowerCase(Locale.ROOT).equals(key)) {
                    continue;
                }
                LocalDate date = plausible(parseLenient(meta.attr("content")));
                if (date != null) {
                    return date;
                }
            }
        }
        for (Element time : document.select("time[datetime]")) {
            LocalDate date = plausible(parseLenient(time.attr("datetime")));
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    public LocalDate fromJsonLd(Document document) {
        for (JsonNode node : jsonLdParser.typedNodes(document)) {
            for (String field : JSON_LD_DATE_FIELDS) {
                LocalDate date = plausible(parseLenient(JsonLdParser.text(node, field)));
                if (date != null) {
                    return date;
                }
            }
        }
        return null;
    }

    public LocalDate fromText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String head = text.substring(0, Math.min(TEXT_SCAN_CHARS, text.length()));
        LocalDate earliestMatch = null;
        int earliestIndex = Integer.MAX_VALUE;
        for (Pattern pattern : List.of(DAY_MONTH_YEAR, MONTH_DAY_YEAR, ISO_DATE, US_DATE)) {
            Matcher matcher = pattern.matcher(head);
            while (matcher.find()) {
                LocalDate candidate = withinTextWindow(plausible(fromTextMatch(pattern, matcher)));
                if (candidate != null) {
                    if (matcher.start() < earliestIndex) {
                        earliestIndex = matcher.start();
                        earliestMatch = candidate;
                    }
                    break;
                }
            }
        }
        return earliestMatch;
    }

    public LocalDate fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        for (Pattern pattern : List.of(URL_YMD_SLASHED, URL_YMD_DASHED, URL_YMD_COMPACT)) {
            Matcher matcher = pattern.matcher(url);
            if (matcher.find()) {
                LocalDate date = plausible(ymd(matcher.group(1), matcher.group(2), matcher.group(3)));
                if (date != null) {
                    return date;
                }
            }
        }
        Matcher month = URL_YM.matcher(url);
        if (month.find()) {
            return plausible(ymd(month.group(1), month.group(2), "1"));
        }
        return null;
    }

    /**
     * Parses the date formats seen in sitemaps, feeds, listing pages and provider metadata. Returns
     * null for anything unrecognised, in the future or before 1990.
     */
    public LocalDate parse(String raw) {
        return plausible(parseLenient(raw));
    }

    private LocalDate parseLenient(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // next format
        }
        if (value.length() >= 10 && ISO_DATE.matcher(value.substring(0, 10)).matches()) {
            return ymd(value.substring(0, 4), value.substring(5, 7), value.substring(8, 10));
        }
        for (Pattern pattern : List.of(DAY_MONTH_YEAR, MONTH_DAY_YEAR, US_DATE)) {
            Matcher matcher = pattern.matcher(value);
            if (matcher.find()) {
                return fromTextMatch(pattern, matcher);
            }
        }
        return null;
    }

    private LocalDate fromTextMatch(Pattern pattern, Matcher matcher) {
        if (pattern == DAY_MONTH_YEAR) {
            return ymd(matcher.group(3), String.valueOf(monthNumber(matcher.group(2))), matcher.group(1));
        }
        if (pattern == MONTH_DAY_YEAR) {
            return ymd(matcher.group(3), String.valueOf(monthNumber(matcher.group(1))), matcher.group(2));
        }
        if (pattern == ISO_DATE) {
            return ymd(matcher.group(1), matcher.group(2), matcher.group(3));
        }
        return ymd(matcher.group(3), matcher.group(1), matcher.group(2));
    }

    public LocalDate plausible(LocalDate date) {
        if (date == null) {
            return null;
        }
        // one day of slack for publishers ahead of our timezone
        LocalDate latest = LocalDate.now(clock).plusDays(1);
        if (date.isAfter(latest) || date.getYear() < 1990) {
            return null;
        }
        return date;
    }

    private LocalDate withinTextWindow(LocalDate date) {
        if (date == null) {
            return null;
        }
        int year = LocalDate.now(clock).getYear();
        return Math.abs(date.getYear() - year) <= TEXT_YEAR_WINDOW ? date : null;
    }

    private LocalDate ymd(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (RuntimeException e) {
            return null;
        }
    }

    private int monthNumber(String name) {
        String prefix = name.substring(0, 3).toLowerCase(Locale.ROOT);
        return switch (prefix) {
            case "jan" -> 1;
            case "feb" -> 2;
            case "mar" -> 3;
            case "apr" -> 4;
            case "may" -> 5;
            case "jun" -> 6;
            case "jul" -> 7;
            case "aug" -> 8;
            case "sep" -> 9;
            case "oct" -> 10;
            case "nov" -> 11;
            default -> 12;
        };
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
