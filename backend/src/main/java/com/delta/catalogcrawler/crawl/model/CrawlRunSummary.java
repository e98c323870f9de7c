package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    List<SourceCrawlSummary> sources,
    int recordsIndexed,
    List<String> errors
) {}
