package com.grantradar.catalog.service;

import com.grantradar.catalog.model.EnrichmentSummary;
import com.grantradar.catalog.store.CatalogLoadException;
import com.grantradar.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one enrichment pass at startup when {@code radar.cli.enrich=true}, for cron-style use.
 */
@Component
public class EnrichmentCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentCliRunner.class);

    private final RadarProperties properties;
    private final EnrichmentService enrichmentService;
    private final ConfigurableApplicationContext applicationContext;

    public EnrichmentCliRunner(
        RadarProperties properties,
        EnrichmentService enrichmentService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.enrichmentService = enrichmentService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        RadarProperties.Cli cli = properties.getCli();
        if (!cli.isEnrich()) {
            return;
        }

        Path input = Path.of(cli.getIn());
        Path output = cli.getOut() == null || cli.getOut().isBlank() ? null : Path.of(cli.getOut());
        int exitCode = 0;
        try {
            EnrichmentSummary summary = enrichmentService.enrich(input, output);
            log.info("Enrichment run finished in {} ms", summary.durationMs());
        } catch (CatalogLoadException e) {
            log.error("Enrichment aborted: {}", e.getMessage());
            exitCode = 1;
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            int status = SpringApplication.exit(applicationContext, () -> code);
            System.exit(status);
        }
    }
}
