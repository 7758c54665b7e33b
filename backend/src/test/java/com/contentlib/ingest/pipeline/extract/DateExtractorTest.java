package com.contentlib.ingest.pipeline.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DateExtractorTest {
    private final DateExtractor extractor = new DateExtractor(
        new JsonLdParser(new ObjectMapper()),
        Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void metaTagWinsOverUrlDate() {
        String html = "<html><head><meta property=\"article:published_time\" content=\"2024-03-12T08:00:00Z\"></head>"
            + "<body><p>Body</p></body></html>";

        assertThat(extractor.fromHtml(html, "https://example.com/2023/01/05/old-slug"))
            .isEqualTo(LocalDate.of(2024, 3, 12));
    }

    @Test
    void readsJsonLdDatePublished() {
        String html = "<html><head><script type=\"application/ld+json\">"
            + "{\"@context\":\"https://schema.org\",\"@type\":\"BlogPosting\",\"datePublished\":\"2024-02-20\"}"
            + "</script></head><body><p>No visible date.</p></body></html>";

        assertThat(extractor.fromHtml(html, "https://example.com/blog/post")).isEqualTo(LocalDate.of(2024, 2, 20));
    }

    @Test
    void futureDatesAreIgnored() {
        String html = "<html><head><meta name=\"date\" content=\"2025-01-01\"></head><body><p>Hello.</p></body></html>";

        assertThat(extractor.fromHtml(html, "https://example.com/2024/05/20/launch-notes"))
            .isEqualTo(LocalDate.of(2024, 5, 20));
    }

    @Test
    void findsVisibleDateNearTopOfText() {
        assertThat(extractor.fromText("Posted by Dana on March 3, 2024 in Engineering"))
            .isEqualTo(LocalDate.of(2024, 3, 3));
        assertThat(extractor.fromText("Updated 14th February 2023")).isEqualTo(LocalDate.of(2023, 2, 14));
        assertThat(extractor.fromText("Version 1.2 notes")).isNull();
    }

    @Test
    void urlPatterns() {
        assertThat(extractor.fromUrl("https://example.com/2023/11/08/post")).isEqualTo(LocalDate.of(2023, 11, 8));
        assertThat(extractor.fromUrl("https://example.com/news/2022-07-15-release")).isEqualTo(LocalDate.of(2022, 7, 15));
        assertThat(extractor.fromUrl("https://example.com/2023/11/post")).isEqualTo(LocalDate.of(2023, 11, 1));
        assertThat(extractor.fromUrl("https://example.com/blog/post")).isNull();
    }

    @Test
    void providerMetadataKeysAreCaseInsensitive() {
        LocalDate date = extractor.fromContent(
            "Body without any date",
            Map.of("publishedTime", "2024-04-02T10:00:00+02:00"),
            "https://example.com/blog/post"
        );

        assertThat(date).isEqualTo(LocalDate.of(2024, 4, 2));
    }

    @Test
    void parsesFeedStyleDates() {
        assertThat(extractor.parse("Tue, 12 Mar 2024 10:00:00 GMT")).isEqualTo(LocalDate.of(2024, 3, 12));
        assertThat(extractor.parse("2024-03-12 10:00")).isEqualTo(LocalDate.of(2024, 3, 12));
        assertThat(extractor.parse("not a date")).isNull();
    }

    @Test
    void parseRejectsFutureAndPreFloorDates() {
        assertThat(extractor.parse("2024-06-02")).isEqualTo(LocalDate.of(2024, 6, 2));
        assertThat(extractor.parse("2031-01-01T00:00:00Z")).isNull();
        assertThat(extractor.parse("Sun, 01 Jan 1989 00:00:00 GMT")).isNull();
        assertThat(extractor.plausible(LocalDate.of(2024, 6, 3))).isNull();
        assertThat(extractor.plausible(null)).isNull();
    }
}
