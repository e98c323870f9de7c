package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RunStateSnapshot(
    Long crawlRunId,
    RunStatus status,
    boolean cancelRequested,
    Instant startedAt,
    Instant finishedAt,
    int sourcesTotal,
    int sourcesDone,
    int recordsFound,
    int recordsEnriched,
    List<String> errors,
    Map<String, SourceStage> sourceStages
) {
    public long activePipelines() {
        return sourceStages.values().stream().filter(SourceStage::isActive).count();
    }
}
