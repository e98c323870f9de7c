package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record CrawlSession(
    long sessionId,
    Long crawlRunId,
    String sourceId,
    Instant startedAt,
    Instant completedAt,
    int pagesWalked,
    int recordsFound,
    CrawlSessionStatus status,
    String error
) {}
