package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.enrich.EnrichmentResult;
import com.delta.catalogcrawler.crawl.enrich.LinkEnricher;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.model.CrawlSessionStatus;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.model.SourceCrawlSummary;
import com.delta.catalogcrawler.crawl.model.SourceStage;
import com.delta.catalogcrawler.crawl.persistence.CrawlLedger;
import com.delta.catalogcrawler.crawl.persistence.PersistenceSink;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import com.delta.catalogcrawler.crawl.render.SourceRenderer;
import com.delta.catalogcrawler.crawl.walk.PaginationWalker;
import com.delta.catalogcrawler.crawl.walk.WalkResult;
import com.delta.catalogcrawler.crawl.walk.WalkTermination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One source's pipeline: walk the listing, optionally enrich, persist whatever was collected, and
 * record the crawl session. Never throws; failures end up in the returned summary.
 */
@Service
public class SourceCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SourceCrawlerService.class);

    private final PaginationWalker paginationWalker;
    private final LinkEnricher linkEnricher;
    private final PersistenceSink persistenceSink;
    private final CrawlLedger crawlLedger;
    private final CrawlerProperties properties;

    public SourceCrawlerService(
        PaginationWalker paginationWalker,
        LinkEnricher linkEnricher,
        PersistenceSink persistenceSink,
        CrawlLedger crawlLedger,
        CrawlerProperties properties
    ) {
        this.paginationWalker = paginationWalker;
        this.linkEnricher = linkEnricher;
        this.persistenceSink = persistenceSink;
        this.crawlLedger = crawlLedger;
        this.properties = properties;
    }

    public SourcePipelineResult crawlSource(Source source, PipelineContext context) {
        Instant startedAt = Instant.now();
        Long sessionId = openSession(context.crawlRunId(), source, startedAt);
        log.info("Crawling source {} from {}", source.label(), source.listingUrl());

        List<CrawlIssue> issues = new ArrayList<>();
        List<CatalogRecord> records = List.of();
        WalkTermination termination = null;
        int pagesWalked = 0;
        int enriched = 0;
        SourceStage stage = SourceStage.DONE;
        String error = null;

        try {
            SourceRenderer renderer = context.renderSession().renderer(renderMode(source));
            WalkResult walk = paginationWalker.walk(
                source,
                renderer,
                context.maxPages(),
                context.cancelled(),
                walkStage -> context.stageListener().onStage(source.id(), walkStage)
            );
            records = walk.records();
            termination = walk.termination();
            pagesWalked = walk.pagesWalked();
            issues.addAll(walk.issues());

            if (walk.failedPermanently()) {
                stage = SourceStage.FAILED;
                error = walk.error().getMessage();
            } else if (context.enrichLinks() && !records.isEmpty() && !context.cancelled().getAsBoolean()) {
                context.stageListener().onStage(source.id(), SourceStage.ENRICHING);
                EnrichmentResult enrichment = linkEnricher.enrich(
                    source,
                    records,
                    context.renderSession().renderer(properties.getEnrichmentRenderMode()),
                    context.cancelled()
                );
                records = enrichment.records();
                enriched = enrichment.enriched();
                issues.addAll(enrichment.issues());
            }
        } catch (RuntimeException e) {
            log.warn("Pipeline for source {} failed", source.id(), e);
            stage = SourceStage.FAILED;
            error = "pipeline_exception: " + e.getMessage();
            issues.add(new CrawlIssue(source.id(), IssueScope.SOURCE, source.listingUrl(), "pipeline_exception", e.getMessage()));
        }

        int persisted = persist(source, records, issues);
        closeSession(sessionId, source, pagesWalked, records.size(), stage, error);
        log.info(
            "Source {} finished: stage={} termination={} pages={} records={} enriched={} persisted={} issues={}",
            source.id(),
            stage,
            termination,
            pagesWalked,
            records.size(),
            enriched,
            persisted,
            issues.size()
        );

        SourceCrawlSummary summary = new SourceCrawlSummary(
            source.id(),
            stage,
            termination,
            pagesWalked,
            records.size(),
            enriched,
            persisted,
            error,
            issues
        );
        return new SourcePipelineResult(summary, records);
    }

    private RenderMode renderMode(Source source) {
        return source.renderMode() == null ? properties.getDefaultRenderMode() : source.renderMode();
    }

    private int persist(Source source, List<CatalogRecord> records, List<CrawlIssue> issues) {
        int persisted = 0;
        for (CatalogRecord record : records) {
            try {
                if (persistenceSink.upsert(record)) {
                    persisted++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to persist record {} of source {}", record.id(), source.id(), e);
                issues.add(new CrawlIssue(source.id(), IssueScope.RECORD, record.detailUrl(), "persist_error", e.getMessage()));
            }
        }
        return persisted;
    }

    private Long openSession(Long crawlRunId, Source source, Instant startedAt) {
        try {
            return crawlLedger.openSession(crawlRunId, source.id(), startedAt);
        } catch (RuntimeException e) {
            log.warn("Unable to open crawl session for {}", source.id(), e);
            return null;
        }
    }

    private void closeSession(Long sessionId, Source source, int pagesWalked, int recordsFound, SourceStage stage, String error) {
        if (sessionId == null) {
            return;
        }
        CrawlSessionStatus status;
        if (stage == SourceStage.FAILED) {
            status = CrawlSessionStatus.FAILED;
        } else if (recordsFound == 0) {
            status = CrawlSessionStatus.NO_RECORDS;
        } else {
            status = CrawlSessionStatus.COMPLETED;
        }
        try {
            crawlLedger.closeSession(sessionId, Instant.now(), pagesWalked, recordsFound, status, error);
        } catch (RuntimeException e) {
            log.warn("Unable to close crawl session {} for {}", sessionId, source.id(), e);
        }
    }
}
