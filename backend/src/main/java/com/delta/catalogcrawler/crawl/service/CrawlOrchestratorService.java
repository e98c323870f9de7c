package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.index.IndexSink;
import com.delta.catalogcrawler.crawl.index.IndexSinkException;
import com.delta.catalogcrawler.crawl.keywords.KeywordProvider;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlRunSummary;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.RunStateSnapshot;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.model.SourceCrawlSummary;
import com.delta.catalogcrawler.crawl.model.SourceStage;
import com.delta.catalogcrawler.crawl.persistence.CrawlLedger;
import com.delta.catalogcrawler.crawl.persistence.PersistenceSink;
import com.delta.catalogcrawler.crawl.render.RenderSession;
import com.delta.catalogcrawler.crawl.render.SourceRendererFactory;
import com.delta.catalogcrawler.crawl.source.SourceRegistry;
import com.delta.catalogcrawler.crawl.walk.WalkTermination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Runs one crawl at a time. Source pipelines are admitted through a counting semaphore so that at most
 * {@code concurrencyLimit} run at once; a failing pipeline never affects its siblings and the run itself
 * never throws once started.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    private final SourceRegistry sourceRegistry;
    private final SourceCrawlerService sourceCrawlerService;
    private final SourceRendererFactory rendererFactory;
    private final IndexSink indexSink;
    private final KeywordProvider keywordProvider;
    private final CrawlLedger crawlLedger;
    private final PersistenceSink persistenceSink;
    private final ExecutorService crawlExecutor;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final RunStateTracker state = new RunStateTracker();

    public CrawlOrchestratorService(
        SourceRegistry sourceRegistry,
        SourceCrawlerService sourceCrawlerService,
        SourceRendererFactory rendererFactory,
        IndexSink indexSink,
        KeywordProvider keywordProvider,
        CrawlLedger crawlLedger,
        PersistenceSink persistenceSink,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties
    ) {
        this.sourceRegistry = sourceRegistry;
        this.sourceCrawlerService = sourceCrawlerService;
        this.rendererFactory = rendererFactory;
        this.indexSink = indexSink;
        this.keywordProvider = keywordProvider;
        this.crawlLedger = crawlLedger;
        this.persistenceSink = persistenceSink;
        this.crawlExecutor = crawlExecutor;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        ClaimedRun claimed = claim(request);
        return execute(claimed, request);
    }

    /**
     * @return the crawl run id, or null when the run ledger was unavailable
     */
    public Long startAsync(CrawlRunRequest request) {
        ClaimedRun claimed = claim(request);
        try {
            crawlRunExecutor.submit(() -> execute(claimed, request));
        } catch (RejectedExecutionException e) {
            state.finish(Instant.now());
            throw e;
        }
        return claimed.crawlRunId();
    }

    /**
     * Asks the active run to stop. Pipelines notice between page fetches and enrichment visits; sources
     * not yet admitted are skipped.
     *
     * @return false when no run is active
     */
    public boolean cancel() {
        if (!state.isRunning()) {
            return false;
        }
        state.requestCancel();
        log.info("Cancellation requested for crawl run {}", state.snapshot().crawlRunId());
        return true;
    }

    public RunStateSnapshot snapshot() {
        return state.snapshot();
    }

    private ClaimedRun claim(CrawlRunRequest request) {
        CrawlRunRequest effective = request == null ? CrawlRunRequest.defaults() : request;
        List<Source> sources = sourceRegistry.findSources(effective.normalizedSourceIds());
        Instant startedAt = Instant.now();
        state.begin(startedAt, sources);
        Long crawlRunId = null;
        try {
            crawlRunId = crawlLedger.insertCrawlRun(startedAt, sources.size());
            state.assignRunId(crawlRunId);
        } catch (RuntimeException e) {
            log.warn("Unable to record crawl run start; crawling without a run row", e);
            state.addError(new CrawlIssue(null, IssueScope.RUN, null, "run_ledger_unavailable", e.getMessage()).describe());
        }
        return new ClaimedRun(crawlRunId, startedAt, sources);
    }

    private CrawlRunSummary execute(ClaimedRun claimed, CrawlRunRequest request) {
        CrawlRunRequest effective = request == null ? CrawlRunRequest.defaults() : request;
        Long crawlRunId = claimed.crawlRunId();
        List<SourceCrawlSummary> summaries = new ArrayList<>();
        List<CatalogRecord> collected = new ArrayList<>();
        int recordsIndexed = 0;
        String status = "FAILED";
        String notes = null;
        Instant finishedAt = null;

        try {
            reloadKeywords();
            int limit = effective.concurrencyLimit() == null
                ? properties.getConcurrencyLimit()
                : Math.min(properties.getConcurrencyLimit(), Math.max(1, effective.concurrencyLimit()));
            int maxPages = effective.maxPagesPerSource() == null
                ? properties.getMaxPagesPerSource()
                : Math.max(1, effective.maxPagesPerSource());
            boolean enrich = effective.enableLinkEnrichment() == null
                ? properties.isEnableLinkEnrichment()
                : effective.enableLinkEnrichment();
            log.info("Crawl run {} started: sources={} concurrency={} maxPages={} enrichment={}",
                crawlRunId, claimed.sources().size(), limit, maxPages, enrich);

            try (RenderSession renderSession = rendererFactory.openSession()) {
                PipelineContext context = new PipelineContext(
                    crawlRunId,
                    renderSession,
                    maxPages,
                    enrich,
                    state::isCancelRequested,
                    state::markStage
                );
                List<PendingPipeline> pending = admitAll(claimed.sources(), context, new Semaphore(limit), summaries);
                for (PendingPipeline pipeline : pending) {
                    SourcePipelineResult result = await(pipeline);
                    summaries.add(result.summary());
                    collected.addAll(result.records());
                }
            }

            recordsIndexed = index(storedVersions(collected));
            status = state.isCancelRequested()
                ? "CANCELLED"
                : state.snapshot().errors().isEmpty() ? "COMPLETED" : "COMPLETED_WITH_ERRORS";
            notes = "sources=" + summaries.size() + ", records=" + collected.size();
        } catch (Exception e) {
            log.warn("Crawl run {} failed", crawlRunId, e);
            state.addError("run_exception: " + e.getMessage());
            status = "FAILED";
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            finishedAt = Instant.now();
            int failed = (int) summaries.stream().filter(summary -> summary.stage() == SourceStage.FAILED).count();
            if (crawlRunId != null) {
                try {
                    crawlLedger.completeCrawlRun(crawlRunId, finishedAt, status, failed, collected.size(), notes);
                } catch (RuntimeException e) {
                    log.warn("Unable to record completion of crawl run {}", crawlRunId, e);
                }
            }
            state.finish(finishedAt);
        }
        RunStateSnapshot snapshot = state.snapshot();
        log.info("Crawl run {} finished: status={} sources={} records={} indexed={} errors={}",
            crawlRunId, status, summaries.size(), collected.size(), recordsIndexed, snapshot.errors().size());
        return new CrawlRunSummary(
            crawlRunId,
            claimed.startedAt(),
            finishedAt,
            status,
            summaries,
            recordsIndexed,
            snapshot.errors()
        );
    }

    private List<PendingPipeline> admitAll(
        List<Source> sources,
        PipelineContext context,
        Semaphore gate,
        List<SourceCrawlSummary> skipped
    ) {
        List<PendingPipeline> pending = new ArrayList<>();
        for (Source source : sources) {
            if (state.isCancelRequested()) {
                skipped.add(skip(source));
                continue;
            }
            try {
                gate.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.requestCancel();
                skipped.add(skip(source));
                continue;
            }
            CompletableFuture<SourcePipelineResult> future;
            try {
                future = CompletableFuture.supplyAsync(
                    () -> sourceCrawlerService.crawlSource(source, context),
                    crawlExecutor
                );
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.failedFuture(e);
            }
            // Joined stage completes only after the state update below.
            future = future.whenComplete((result, error) -> {
                gate.release();
                if (error == null) {
                    SourceCrawlSummary summary = result.summary();
                    state.sourceFinished(source.id(), summary.stage(), summary.recordsFound(), summary.recordsEnriched(), summary.error());
                }
            });
            pending.add(new PendingPipeline(source, future));
        }
        return pending;
    }

    private SourcePipelineResult await(PendingPipeline pipeline) {
        Source source = pipeline.source();
        try {
            return pipeline.future().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Pipeline for source {} failed", source.id(), cause);
            String error = "pipeline_exception: " + cause.getMessage();
            state.sourceFinished(source.id(), SourceStage.FAILED, 0, 0, error);
            SourceCrawlSummary summary = new SourceCrawlSummary(
                source.id(),
                SourceStage.FAILED,
                null,
                0,
                0,
                0,
                0,
                error,
                List.of(new CrawlIssue(source.id(), IssueScope.SOURCE, source.listingUrl(), "pipeline_exception", cause.getMessage()))
            );
            return new SourcePipelineResult(summary, List.of());
        }
    }

    private SourceCrawlSummary skip(Source source) {
        state.sourceFinished(source.id(), SourceStage.DONE, 0, 0, null);
        return new SourceCrawlSummary(source.id(), SourceStage.DONE, WalkTermination.CANCELLED, 0, 0, 0, 0, null, List.of());
    }

    /**
     * Swaps each crawled record for its stored row, which also carries links and prices kept from
     * earlier crawls. Records that cannot be read back are indexed as crawled.
     */
    private List<CatalogRecord> storedVersions(List<CatalogRecord> crawled) {
        if (crawled.isEmpty()) {
            return crawled;
        }
        Map<String, CatalogRecord> stored = new HashMap<>();
        try {
            for (CatalogRecord record : persistenceSink.findRecords(crawled.stream().map(CatalogRecord::id).toList())) {
                stored.put(record.id(), record);
            }
        } catch (RuntimeException e) {
            log.warn("Unable to read stored records for indexing; indexing crawled values", e);
            state.addError(new CrawlIssue(null, IssueScope.RUN, null, "index_readback_error", e.getMessage()).describe());
        }
        List<CatalogRecord> out = new ArrayList<>(crawled.size());
        for (CatalogRecord record : crawled) {
            out.add(stored.getOrDefault(record.id(), record));
        }
        return out;
    }

    private int index(List<CatalogRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        try {
            return indexSink.index(records);
        } catch (IndexSinkException e) {
            log.warn("Indexing partially failed: {}", e.getMessage());
            state.addError(new CrawlIssue(null, IssueScope.RUN, null, "index_error", e.getMessage()).describe());
            return e.getIndexed();
        } catch (RuntimeException e) {
            log.warn("Indexing failed", e);
            state.addError(new CrawlIssue(null, IssueScope.RUN, null, "index_error", e.getMessage()).describe());
            return 0;
        }
    }

    private void reloadKeywords() {
        try {
            keywordProvider.reload();
        } catch (RuntimeException e) {
            log.warn("Keyword reload before crawl failed; using previous tables", e);
        }
    }

    private record ClaimedRun(Long crawlRunId, Instant startedAt, List<Source> sources) {}

    private record PendingPipeline(Source source, CompletableFuture<SourcePipelineResult> future) {}
}
