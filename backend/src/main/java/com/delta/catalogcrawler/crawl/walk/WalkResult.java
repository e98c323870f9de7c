package com.delta.catalogcrawler.crawl.walk;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.render.FetchException;

import java.util.List;

/**
 * Outcome of walking one source. Records gathered before a fetch error or cancellation are kept.
 */
public record WalkResult(
    List<CatalogRecord> records,
    int pagesWalked,
    WalkTermination termination,
    FetchException error,
    List<CrawlIssue> issues
) {
    public WalkResult {
        records = records == null ? List.of() : List.copyOf(records);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean failedPermanently() {
        return termination == WalkTermination.FETCH_ERROR && error != null && error.isPermanent();
    }
}
