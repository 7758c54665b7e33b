package com.contentlib.ingest.pipeline.service;

import com.contentlib.ingest.config.IngestProperties;
import com.contentlib.ingest.pipeline.dedup.DuplicateChecker;
import com.contentlib.ingest.pipeline.model.DiscoveredUrl;
import com.contentlib.ingest.pipeline.model.DiscoveryOptions;
import com.contentlib.ingest.pipeline.model.DiscoveryReport;
import com.contentlib.ingest.pipeline.model.DuplicateCheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot discovery from the command line, e.g.
 * {@code --ingest.cli.run=true --ingest.cli.url=https://example.com/blog --ingest.cli.scope=acme}.
 */
@Component
public class ImportCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportCliRunner.class);

    private final IngestProperties properties;
    private final ContentDiscoveryService discoveryService;
    private final DuplicateChecker duplicateChecker;
    private final ConfigurableApplicationContext applicationContext;

    public ImportCliRunner(
        IngestProperties properties,
        ContentDiscoveryService discoveryService,
        DuplicateChecker duplicateChecker,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.duplicateChecker = duplicateChecker;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        IngestProperties.Cli cli = properties.getCli();
        if (cli.getUrl() == null || cli.getUrl().isBlank()) {
            log.warn("cli run requested without ingest.cli.url, nothing to do");
        } else {
            DiscoveryReport report = discoveryService.discover(cli.getUrl(), DiscoveryOptions.defaults(cli.getMaxUrls()));
            log.info(
                "cli discovery base={} method={} urls={} discovered={} rejected={} credits={} errors={}",
                report.baseUrl(),
                report.method(),
                report.urls().size(),
                report.discoveredCount(),
                report.rejectedByValidation(),
                report.creditsUsed(),
                report.errors()
            );
            for (DiscoveredUrl url : report.urls()) {
                log.info("post url={} date={} title={}", url.url(), url.publishedDate(), url.title());
            }
            if (cli.getScope() != null && !cli.getScope().isBlank()) {
                DuplicateCheckResult duplicates = duplicateChecker.checkForDuplicates(report.urls(), cli.getScope().trim());
                log.info(
                    "cli duplicate check scope={} new={} duplicates={}",
                    cli.getScope(),
                    duplicates.stats().newCount(),
                    duplicates.stats().duplicateCount()
                );
            }
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
