package com.delta.catalogcrawler.crawl.model;

import com.delta.catalogcrawler.crawl.walk.WalkTermination;

import java.util.List;

public record SourceCrawlSummary(
    String sourceId,
    SourceStage stage,
    WalkTermination termination,
    int pagesWalked,
    int recordsFound,
    int recordsEnriched,
    int recordsPersisted,
    String error,
    List<CrawlIssue> issues
) {}
