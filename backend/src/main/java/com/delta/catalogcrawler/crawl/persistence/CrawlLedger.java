package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.model.CrawlSessionStatus;

import java.time.Instant;

/**
 * Bookkeeping rows for crawl runs and the per-source sessions inside them.
 */
public interface CrawlLedger {

    long insertCrawlRun(Instant startedAt, int sourcesTotal);

    void completeCrawlRun(
        long crawlRunId,
        Instant finishedAt,
        String status,
        int sourcesFailed,
        int recordsFound,
        String notes
    );

    long openSession(Long crawlRunId, String sourceId, Instant startedAt);

    void closeSession(
        long sessionId,
        Instant completedAt,
        int pagesWalked,
        int recordsFound,
        CrawlSessionStatus status,
        String error
    );
}
