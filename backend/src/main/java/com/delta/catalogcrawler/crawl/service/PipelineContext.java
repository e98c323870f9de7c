package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.model.SourceStage;
import com.delta.catalogcrawler.crawl.render.RenderSession;

import java.util.function.BooleanSupplier;

/**
 * What a single source pipeline needs from the run it belongs to.
 */
public record PipelineContext(
    Long crawlRunId,
    RenderSession renderSession,
    int maxPages,
    boolean enrichLinks,
    BooleanSupplier cancelled,
    StageListener stageListener
) {
    @FunctionalInterface
    public interface StageListener {
        void onStage(String sourceId, SourceStage stage);
    }
}
