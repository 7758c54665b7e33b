package com.contentlib.ingest.pipeline.api;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.dedup.DuplicateChecker;
import com.contentlib.ingest.pipeline.extract.ScrapeOrchestrator;
import com.contentlib.ingest.pipeline.model.DiscoveryOptions;
import com.contentlib.ingest.pipeline.model.DiscoveryReport;
import com.contentlib.ingest.pipeline.reader.ResilientReaderClient;
import com.contentlib.ingest.pipeline.service.ContentDiscoveryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImportControllerRequestDefaultsTest {

    @Mock
    private ContentDiscoveryService discoveryService;
    @Mock
    private DuplicateChecker duplicateChecker;
    @Mock
    private ScrapeOrchestrator scrapeOrchestrator;
    @Mock
    private ResilientReaderClient readerClient;

    private final IngestProperties properties = new IngestProperties();

    @Test
    void appliesConfiguredDefaultsWhenRequestOmitsThem() {
        properties.getDiscovery().setMaxUrls(42);
        when(discoveryService.discover(eq("example.com/blog"), any())).thenReturn(emptyReport());

        controller().discover(new DiscoverApiRequest("example.com/blog", null, null, null, null, null, null));

        ArgumentCaptor<DiscoveryOptions> captor = ArgumentCaptor.forClass(DiscoveryOptions.class);
        verify(discoveryService).discover(eq("example.com/blog"), captor.capture());
        DiscoveryOptions options = captor.getValue();
        assertThat(options.maxUrls()).isEqualTo(42);
        assertThat(options.maxPosts()).isNull();
        assertThat(options.languages()).isEmpty();
        assertThat(options.includeUndetected()).isTrue();
    }

    @Test
    void oversizedMaxUrlsIsClampedToTheConfiguredLimit() {
        when(discoveryService.discover(eq("https://example.com/blog"), any())).thenReturn(emptyReport());

        controller().discover(new DiscoverApiRequest("https://example.com/blog", Integer.MAX_VALUE, null, null, null, null, null));

        ArgumentCaptor<DiscoveryOptions> captor = ArgumentCaptor.forClass(DiscoveryOptions.class);
        verify(discoveryService).discover(eq("https://example.com/blog"), captor.capture());
        assertThat(captor.getValue().maxUrls()).isEqualTo(properties.getDiscovery().getMaxUrlsLimit());
    }

    @Test
    void rejectsScrapeBatchesOverTheCap() {
        properties.getScrape().setMaxUrls(2);
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            urls.add("https://example.com/blog/post-number-" + i);
        }

        assertThatThrownBy(() -> controller().scrape(new ScrapeApiRequest(urls)))
            .isInstanceOf(ResponseStatusException.class)
            .hasMessageContaining("At most 2 urls");
        verify(scrapeOrchestrator, never()).scrapeSelected(anyList(), any());
    }

    @Test
    void trimsDuplicateScope() {
        controller().checkDuplicates(new DuplicateCheckApiRequest(null, "  acme  "));

        verify(duplicateChecker).checkForDuplicates(List.of(), "acme");
    }

    private ImportController controller() {
        return new ImportController(discoveryService, duplicateChecker, scrapeOrchestrator, readerClient, properties);
    }

    private static DiscoveryReport emptyReport() {
        return new DiscoveryReport("https://example.com/blog", List.of(), "none", 0, 0, 0, 0, List.of(), List.of(), Map.of());
    }
}
