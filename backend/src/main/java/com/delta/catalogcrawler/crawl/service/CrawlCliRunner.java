package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlRunSummary;
import com.delta.catalogcrawler.crawl.model.SourceCrawlSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String configured = properties.getCli().getSources() == null ? "" : properties.getCli().getSources();
        List<String> sourceIds = Arrays.stream(configured.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        CrawlRunSummary summary = crawlOrchestratorService.run(new CrawlRunRequest(sourceIds, null, null, null));
        log.info("Crawl run {} completed with status {}", summary.crawlRunId(), summary.status());
        for (SourceCrawlSummary source : summary.sources()) {
            log.info(
                "Summary {}: stage={}, termination={}, pages={}, records={}, enriched={}, persisted={}, error={}",
                source.sourceId(),
                source.stage(),
                source.termination(),
                source.pagesWalked(),
                source.recordsFound(),
                source.recordsEnriched(),
                source.recordsPersisted(),
                source.error()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
