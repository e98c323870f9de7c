package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.SourceCrawlSummary;

import java.util.List;

public record SourcePipelineResult(SourceCrawlSummary summary, List<CatalogRecord> records) {
    public SourcePipelineResult {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
