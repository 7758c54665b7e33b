package com.contentlib.ingest.pipeline.pagination;

import com.contentlib.ingest.pipeline.extract.DateExtractor;
import com.contentlib.ingest.pipeline.extract.JsonLdParser;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.ListingPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ListingPageParserTest {
    private static final String BLOG = "https://example.com/blog";

    private final ListingPageParser parser = new ListingPageParser(new DateExtractor(
        new JsonLdParser(new ObjectMapper()),
        Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC)
    ));

    @Test
    void collectsPostLinksWithTitlesAndDates() {
        String html = "<html><body>"
            + "<article><h2><a href=\"/blog/how-we-scaled-our-api-gateway\">How we scaled our API gateway</a></h2>"
            + "<time datetime=\"2024-03-01\">March 1</time></article>"
            + "<div class=\"card\"><h3>Designing resilient reader pipelines</h3>"
            + "<a href=\"/blog/designing-resilient-reader-pipelines\">Read more</a></div>"
            + "</body></html>";

        ListingPage page = parser.parse(html, BLOG, BLOG);

        assertThat(page.posts()).extracting(DiscoveredUrl::url).containsExactly(
            BLOG + "/how-we-scaled-our-api-gateway",
            BLOG + "/designing-resilient-reader-pipelines"
        );
        assertThat(page.posts().get(0).title()).isEqualTo("How we scaled our API gateway");
        assertThat(page.posts().get(0).publishedDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(page.posts().get(1).title()).isEqualTo("Designing resilient reader pipelines");
        assertThat(page.posts().get(1).publishedDate()).isNull();
    }

    @Test
    void futureOrAncientTimeElementIsIgnored() {
        String html = "<html><body>"
            + "<article><h2><a href=\"/blog/upcoming-conference-talk-recap\">Upcoming conference talk recap</a></h2>"
            + "<time datetime=\"2031-01-01T00:00:00Z\">Soon</time></article>"
            + "<article><h2><a href=\"/blog/2023/11/02/migrated-from-the-old-platform\">Migrated from the old platform</a></h2>"
            + "<time datetime=\"1970-01-01\">Epoch</time></article>"
            + "</body></html>";

        ListingPage page = parser.parse(html, BLOG, BLOG);

        assertThat(page.posts()).hasSize(2);
        assertThat(page.posts().get(0).publishedDate()).isNull();
        assertThat(page.posts().get(1).publishedDate()).isEqualTo(LocalDate.of(2023, 11, 2));
    }

    @Test
    void skipsNavigationTaxonomyAndShortLinks() {
        String html = "<html><body>"
            + "<article><a href=\"/blog\">All blog posts in one place</a></article>"
            + "<article><a href=\"/blog/category/engineering\">Engineering category page</a></article>"
            + "<article><a href=\"/about-us\">Learn more about our company</a></article>"
            + "<article><a href=\"/blog/launch-notes-for-march#comments\">Comments on the launch notes</a></article>"
            + "<h3><a href=\"/blog/short-post-title\">Hi</a></h3>"
            + "<article><a href=\"https://other.com/blog/competitor-roundup-post\">Competitor roundup post</a></article>"
            + "</body></html>";

        ListingPage page = parser.parse(html, BLOG, BLOG);

        assertThat(page.posts()).isEmpty();
    }

    @Test
    void collectsSameSitePaginationLinksOnce() {
        String html = "<html><body>"
            + "<nav class=\"pagination\"><a href=\"/blog?page=2\">2</a><a href=\"/blog?page=3\">3</a></nav>"
            + "<a rel=\"next\" href=\"/blog?page=2\">Next</a>"
            + "<a href=\"https://other.com/blog?page=2\">Elsewhere</a>"
            + "</body></html>";

        ListingPage page = parser.parse(html, BLOG, BLOG);

        assertThat(page.paginationLinks()).containsExactly(BLOG + "?page=2", BLOG + "?page=3");
    }

    @Test
    void sectionNamedByTheListingIsNotExcluded() {
        String listing = "https://example.com/news";

        assertThat(parser.isExcluded("https://example.com/news/quarterly-results-announced", listing, "/news")).isFalse();
        assertThat(parser.isExcluded("https://example.com/news/tag/finance", listing, "/news")).isTrue();
        assertThat(parser.isExcluded("https://example.com/products/widget-pro/overview", BLOG, "/blog")).isTrue();
        assertThat(parser.isExcluded("https://example.com/blog/post-one?category=dev", BLOG, "/blog")).isTrue();
    }
}
