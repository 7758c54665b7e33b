package com.contentlib.ingest.pipeline.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class ContentCleaner {
    private static final int MIN_HEADING_TEXT = 20;
    private static final int MIN_LINES_BEFORE_FOOTER = 5;
    private static final int LINK_RUN_FOR_FOOTER = 5;

    private static final Pattern ATX_HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern SETEXT_UNDERLINE = Pattern.compile("^(=+|-+)\\s*$");
    private static final Pattern BARE_LINK_LINE = Pattern.compile("^\\s*(?:[-*+]\\s+|\\d+\\.\\s+)?\\[[^\\]]{0,80}\\]\\([^)]*\\)\\s*$");
    private static final Pattern IMAGE = Pattern.compile("!\\[[^\\]]*\\]\\(([^)\\s]+)[^)]*\\)");
    private static final Pattern COPYRIGHT = Pattern.compile("(?i)(©|&copy;|\\(c\\)|copyright)\\s*(?:\\d{4}|[a-z])|all rights reserved");
    private static final Pattern SKIP_LINK = Pattern.compile("(?i)^\\s*\\[?(skip to (main )?content|skip navigation|jump to content)");
    private static final Pattern NAV_NOISE = Pattern.compile(
        "(?i)^(menu|home|search|sign in|log ?in|sign up|subscribe|toggle navigation|main navigation|navigation|"
            + "close|open menu|back to top|share|share this|follow us|cookie.*|accept( all)? cookies)$"
    );
    private static final Pattern FOOTER_HEADING = Pattern.compile(
        "(?i)^(related (posts|articles|reading|content)|you (may|might) also like|more (posts|articles|from)|"
            + "recent posts|popular posts|read next|share this( (post|article))?|about the author|"
            + "subscribe.*|newsletter|sign up for.*|leave a (reply|comment)|comments?|footer|"
            + "tags?|categories|follow us|get in touch|contact us)\\b.*$"
    );
    private static final Pattern TRACKING_SOURCE = Pattern.compile(
        "(?i)(1x1|pixel|beacon|track(ing)?|/collect\\?|analytics|doubleclick|facebook\\.com/tr|"
            + "google-analytics|googletagmanager|\\bspacer\\.gif|/p\\.gif|utm\\.gif|hsforms|hubspot\\.com/.+/track)"
    );

    public String clean(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        List<String> lines = List.of(markdown.replace("\r\n", "\n").replace("\uFEFF", "").split("\n", -1));

        int start = findArticleStart(lines);
        if (start < 0) {
            return collapse(dropNoise(lines));
        }
        int end = findArticleEnd(lines, start);
        return collapse(dropNoise(lines.subList(start, end)));
    }

    int findArticleStart(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String headingText = headingText(lines, i);
            if (headingText == null) {
                continue;
            }
            String text = stripInlineMarkup(headingText);
            if (text.length() > MIN_HEADING_TEXT && !NAV_NOISE.matcher(text).matches()) {
                return i;
            }
        }
        return -1;
    }

    int findArticleEnd(List<String> lines, int start) {
        int earliestFooter = start + MIN_LINES_BEFORE_FOOTER;
        int linkRunStart = -1;
        int linkRunLength = 0;
        for (int i = start + 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (i >= earliestFooter) {
                if (COPYRIGHT.matcher(line).find() && line.length() < 200) {
                    return linkRunStart >= 0 ? linkRunStart : i;
                }
                String heading = headingText(lines, i);
                if (heading != null && FOOTER_HEADING.matcher(stripInlineMarkup(heading)).matches()) {
                    return i;
                }
            }
            if (BARE_LINK_LINE.matcher(line).matches()) {
                if (linkRunStart < 0) {
                    linkRunStart = i;
                }
                linkRunLength++;
                if (linkRunLength >= LINK_RUN_FOR_FOOTER && linkRunStart >= earliestFooter) {
                    return linkRunStart;
                }
            } else if (!line.isEmpty()) {
                linkRunStart = -1;
                linkRunLength = 0;
            }
        }
        return lines.size();
    }

    private List<String> dropNoise(List<String> lines) {
        List<String> kept = new ArrayList<>(lines.size());
        for (String line : lines) {
            String trimmed = line.trim();
            if (SKIP_LINK.matcher(trimmed).find()) {
                continue;
            }
            if (isTrackingImageOnly(trimmed)) {
                continue;
            }
            if (BARE_LINK_LINE.matcher(trimmed).matches() && NAV_NOISE.matcher(linkText(trimmed)).matches()) {
                continue;
            }
            if (NAV_NOISE.matcher(stripInlineMarkup(trimmed)).matches()) {
                continue;
            }
            kept.add(stripTrackingImages(line));
        }
        return kept;
    }

    private boolean isTrackingImageOnly(String line) {
        Matcher matcher = IMAGE.matcher(line);
        if (!matcher.find()) {
            return false;
        }
        return TRACKING_SOURCE.matcher(matcher.group(1)).find() && IMAGE.matcher(line).replaceAll("").isBlank();
    }

    private String stripTrackingImages(String line) {
        if (!line.contains("![")) {
            return line;
        }
        return IMAGE.matcher(line).replaceAll(match ->
            TRACKING_SOURCE.matcher(match.group(1)).find() ? "" : Matcher.quoteReplacement(match.group())
        );
    }

    private String headingText(List<String> lines, int index) {
        String line = lines.get(index).trim();
        Matcher atx = ATX_HEADING.matcher(line);
        if (atx.matches()) {
            return atx.group(1);
        }
        if (!line.isEmpty() && index + 1 < lines.size()
            && SETEXT_UNDERLINE.matcher(lines.get(index + 1).trim()).matches()
            && !BARE_LINK_LINE.matcher(line).matches()) {
            return line;
        }
        return null;
    }

    private String linkText(String line) {
        int open = line.indexOf('[');
        int close = line.indexOf(']');
        return open >= 0 && close > open ? line.substring(open + 1, close).trim() : line;
    }

    private String stripInlineMarkup(String text) {
        return text.replaceAll("!?\\[([^\\]]*)\\]\\([^)]*\\)", "$1")
            .replaceAll("[*_`]", "")
            .trim()
            .toLowerCase(Locale.ROOT);
    }

    private String collapse(List<String> lines) {
        StringBuilder builder = new StringBuilder();
        int blankRun = 0;
        for (String line : lines) {
            String trimmedRight = line.stripTrailing();
            if (trimmedRight.isBlank()) {
                blankRun++;
                if (blankRun > 1) {
                    continue;
                }
                builder.append('\n');
                continue;
            }
            blankRun = 0;
            builder.append(trimmedRight).append('\n');
        }
        return builder.toString().trim();
    }
}
