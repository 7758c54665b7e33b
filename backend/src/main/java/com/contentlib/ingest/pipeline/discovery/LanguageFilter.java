package com.contentlib.ingest.pipeline.discovery;

import com.contentlib.ingest.pipeline.model.DiscoveredUrl;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record LanguageFilter(Set<String> languages, boolean includeUndetected) {
    public static final LanguageFilter ANY = new LanguageFilter(Set.of(), true);

    public LanguageFilter {
        languages = Set.copyOf(languages);
    }

    public static LanguageFilter of(List<String> requested, boolean includeUndetected) {
        if (requested == null || requested.isEmpty()) {
            return ANY;
        }
        Set<String> codes = new LinkedHashSet<>();
        for (String language : requested) {
            if (language != null && !language.isBlank()) {
                codes.add(language.trim().toLowerCase(Locale.ROOT));
            }
        }
        return codes.isEmpty() ? ANY : new LanguageFilter(codes, includeUndetected);
    }

    public boolean isActive() {
        return !languages.isEmpty();
    }

    public boolean accepts(DiscoveredUrl item) {
        if (!isActive()) {
            return true;
        }
        if (item.language() == null) {
            return includeUndetected;
        }
        return languages.contains(item.language());
    }

    /**
     * Fills in the detected language and content section when discovery left them blank.
     */
    public static DiscoveredUrl tag(DiscoveredUrl item) {
        if (item.language() != null && item.contentSection() != null) {
            return item;
        }
        String language = item.language() == null ? UrlLanguageDetector.detect(item.url()) : item.language();
        String section = item.contentSection() == null ? UrlHeuristics.contentSection(item.url()) : item.contentSection();
        if (language == null && section == null) {
            return item;
        }
        return new DiscoveredUrl(item.url(), item.title(), item.publishedDate(), section, language);
    }

    public List<DiscoveredUrl> apply(List<DiscoveredUrl> items) {
        return items.stream().map(LanguageFilter::tag).filter(this::accepts).toList();
    }
}
