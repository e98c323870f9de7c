package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.model.RunStateSnapshot;
import com.delta.catalogcrawler.crawl.model.RunStatus;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.model.SourceStage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable run state. Every mutation and every snapshot happens under this object's monitor, so a
 * snapshot never mixes two moments of the run.
 */
public class RunStateTracker {
    private RunStatus status = RunStatus.IDLE;
    private Long crawlRunId;
    private boolean cancelRequested;
    private Instant startedAt;
    private Instant finishedAt;
    private int sourcesTotal;
    private int sourcesDone;
    private int recordsFound;
    private int recordsEnriched;
    private final List<String> errors = new ArrayList<>();
    private final Map<String, SourceStage> sourceStages = new LinkedHashMap<>();

    /**
     * Moves IDLE to RUNNING and resets the counters.
     *
     * @throws ActiveCrawlRunException when a run is already in progress
     */
    public synchronized void begin(Instant startedAt, List<Source> sources) {
        if (status == RunStatus.RUNNING) {
            throw new ActiveCrawlRunException("Active crawl run in progress (id=" + crawlRunId
                + ", startedAt=" + this.startedAt + ")");
        }
        status = RunStatus.RUNNING;
        crawlRunId = null;
        cancelRequested = false;
        this.startedAt = startedAt;
        finishedAt = null;
        sourcesTotal = sources.size();
        sourcesDone = 0;
        recordsFound = 0;
        recordsEnriched = 0;
        errors.clear();
        sourceStages.clear();
        for (Source source : sources) {
            sourceStages.put(source.id(), SourceStage.PENDING);
        }
    }

    public synchronized void assignRunId(long crawlRunId) {
        this.crawlRunId = crawlRunId;
    }

    public synchronized void markStage(String sourceId, SourceStage stage) {
        SourceStage current = sourceStages.get(sourceId);
        if (current != null && current.isTerminal()) {
            return;
        }
        sourceStages.put(sourceId, stage);
    }

    public synchronized void sourceFinished(String sourceId, SourceStage terminalStage, int found, int enriched, String error) {
        SourceStage current = sourceStages.get(sourceId);
        if (current != null && current.isTerminal()) {
            return;
        }
        sourceStages.put(sourceId, terminalStage);
        sourcesDone++;
        recordsFound += found;
        recordsEnriched += enriched;
        if (error != null) {
            errors.add(sourceId + ": " + error);
        }
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    public synchronized void requestCancel() {
        if (status == RunStatus.RUNNING) {
            cancelRequested = true;
        }
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    public synchronized void finish(Instant finishedAt) {
        status = RunStatus.IDLE;
        this.finishedAt = finishedAt;
    }

    public synchronized RunStateSnapshot snapshot() {
        return new RunStateSnapshot(
            crawlRunId,
            status,
            cancelRequested,
            startedAt,
            finishedAt,
            sourcesTotal,
            sourcesDone,
            recordsFound,
            recordsEnriched,
            List.copyOf(errors),
            Collections.unmodifiableMap(new LinkedHashMap<>(sourceStages))
        );
    }
}
