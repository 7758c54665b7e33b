package com.contentlib.ingest.pipeline.service;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.discovery.DiscoveryChain;
import com.contentlib.ingest.pipeline.discovery.LanguageFilter;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.DiscoveryMethod;
import com.contentlib.ingest.pipeline.model.DiscoveryOptions;
import com.contentlib.ingest.pipeline.model.DiscoveryReport;
import com.contentlib.ingest.pipeline.model.DiscoveryResult;
import com.contentlib.ingest.pipeline.pagination.PaginationWalker;
import com.contentlib.ingest.pipeline.validate.CandidateValidationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentDiscoveryServiceTest {
    private static final String BASE = "https://example.com/blog";

    @Mock private DiscoveryChain discoveryChain;
    @Mock private PaginationWalker paginationWalker;
    @Mock private CandidateValidationService validationService;

    private final IngestProperties properties = new IngestProperties();

    @Test
    void filtersByLanguageAndTagsEveryUrl() {
        properties.getValidation().setEnabled(false);
        when(discoveryChain.discover(eq(BASE), eq(50), any(LanguageFilter.class))).thenReturn(new DiscoveryResult(
            List.of(
                post("https://example.com/de/blog/kubernetes-im-betrieb", null),
                post("https://example.com/blog/running-kubernetes-in-production", null),
                post("https://example.com/fr/blog/kubernetes-en-production", null)
            ),
            DiscoveryMethod.SITEMAP,
            0,
            false,
            Map.of(),
            0
        ));

        DiscoveryReport report = service().discover(BASE, new DiscoveryOptions(50, null, null, null, List.of("DE"), false));

        assertThat(report.method()).isEqualTo("sitemap");
        assertThat(report.discoveredCount()).isEqualTo(3);
        assertThat(report.filteredOut()).isEqualTo(2);
        assertThat(report.urls()).extracting(DiscoveredUrl::url)
            .containsExactly("https://example.com/de/blog/kubernetes-im-betrieb");
        assertThat(report.urls().get(0).language()).isEqualTo("de");
        assertThat(report.detectedLanguages()).containsExactly("de");
        verify(validationService, never()).validateAll(anyList());
    }

    @Test
    void undetectedLanguageIsKeptWhenAsked() {
        properties.getValidation().setEnabled(false);
        when(discoveryChain.discover(eq(BASE), eq(50), any(LanguageFilter.class))).thenReturn(new DiscoveryResult(
            List.of(
                post("https://example.com/de/blog/kubernetes-im-betrieb", null),
                post("https://example.com/blog/running-kubernetes-in-production", null)
            ),
            DiscoveryMethod.RSS,
            0,
            false,
            Map.of(),
            0
        ));

        DiscoveryReport report = service().discover(BASE, new DiscoveryOptions(50, null, null, null, List.of("de"), true));

        assertThat(report.urls()).hasSize(2);
        assertThat(report.filteredOut()).isZero();
    }

    @Test
    void fallsBackToPaginationAndValidates() {
        List<DiscoveredUrl> walked = List.of(
            post("https://example.com/blog/first-post-from-listing", LocalDate.of(2024, 1, 10)),
            post("https://example.com/blog/second-post-from-listing", LocalDate.of(2024, 2, 10)),
            post("https://example.com/blog/pricing-comparison-page", null)
        );
        when(discoveryChain.discover(eq(BASE), eq(25), any(LanguageFilter.class))).thenReturn(DiscoveryResult.fallback(2, Map.of("sitemap", "http_404=1")));
        when(paginationWalker.walk(BASE, properties.getPagination().getMaxPages(), 10)).thenReturn(walked);
        when(validationService.validateAll(anyList())).thenAnswer(invocation -> {
            List<DiscoveredUrl> candidates = invocation.getArgument(0);
            return new CandidateValidationService.ValidationOutcome(candidates.subList(0, 2), 1);
        });

        DiscoveryReport report = service().discover(BASE, new DiscoveryOptions(25, 10, null, null, List.of(), true));

        assertThat(report.method()).isEqualTo("pagination");
        assertThat(report.discoveredCount()).isEqualTo(3);
        assertThat(report.rejectedByValidation()).isEqualTo(1);
        assertThat(report.creditsUsed()).isEqualTo(2);
        assertThat(report.urls()).hasSize(2);
        assertThat(report.contentSections()).containsExactly("blog");
        assertThat(report.errors()).containsEntry("sitemap", "http_404=1");
    }

    @Test
    void paginationPostsInOtherLanguagesAreDroppedBeforeValidation() {
        List<DiscoveredUrl> walked = List.of(
            post("https://example.com/blog/running-postgres-on-kubernetes", null),
            post("https://example.com/de/blog/postgres-auf-kubernetes", null)
        );
        when(discoveryChain.discover(eq(BASE), eq(50), any(LanguageFilter.class))).thenReturn(DiscoveryResult.fallback(0, Map.of()));
        when(paginationWalker.walk(BASE, properties.getPagination().getMaxPages(), 50)).thenReturn(walked);
        when(validationService.validateAll(anyList())).thenAnswer(invocation ->
            new CandidateValidationService.ValidationOutcome(invocation.getArgument(0), 0));

        DiscoveryReport report = service().discover(BASE, new DiscoveryOptions(50, null, null, null, List.of("en"), true));

        assertThat(report.urls()).extracting(DiscoveredUrl::url)
            .containsExactly("https://example.com/blog/running-postgres-on-kubernetes");
        assertThat(report.filteredOut()).isEqualTo(1);
        verify(validationService).validateAll(List.of(LanguageFilter.tag(walked.get(0))));
    }

    @Test
    void emptyPaginationReportsNoMethod() {
        when(discoveryChain.discover(eq(BASE), eq(50), any(LanguageFilter.class))).thenReturn(DiscoveryResult.fallback(0, Map.of()));
        when(paginationWalker.walk(BASE, properties.getPagination().getMaxPages(), 50)).thenReturn(List.of());

        DiscoveryReport report = service().discover(BASE, DiscoveryOptions.defaults(50));

        assertThat(report.method()).isEqualTo("none");
        assertThat(report.urls()).isEmpty();
        assertThat(report.errors()).containsEntry("pagination", "no_posts_found");
        verify(validationService, never()).validateAll(anyList());
    }

    @Test
    void dateRangeIsInclusiveAndKeepsUndatedPosts() {
        LocalDate from = LocalDate.of(2024, 1, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);

        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/a", LocalDate.of(2024, 3, 31)), from, to)).isTrue();
        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/b", LocalDate.of(2024, 1, 1)), from, to)).isTrue();
        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/c", LocalDate.of(2023, 12, 31)), from, to)).isFalse();
        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/d", LocalDate.of(2024, 4, 1)), from, to)).isFalse();
        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/e", null), from, to)).isTrue();
        assertThat(ContentDiscoveryService.matchesDateRange(post(BASE + "/f", LocalDate.of(1999, 1, 1)), null, null)).isTrue();
    }

    @Test
    void rejectsUnparseableUrl() {
        assertThatThrownBy(() -> service().discover("not a url", null))
            .isInstanceOf(IllegalArgumentException.class);
        verify(discoveryChain, never()).discover(anyString(), anyInt(), any(LanguageFilter.class));
        verify(paginationWalker, never()).walk(anyString(), anyInt(), any());
    }

    private ContentDiscoveryService service() {
        return new ContentDiscoveryService(discoveryChain, paginationWalker, validationService, properties);
    }

    private static DiscoveredUrl post(String url, LocalDate date) {
        return new DiscoveredUrl(url, "Some post title", date, null, null);
    }
}
