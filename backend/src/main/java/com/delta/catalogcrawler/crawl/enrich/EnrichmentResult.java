package com.delta.catalogcrawler.crawl.enrich;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;

import java.util.List;

/**
 * @param records    input records in their original order, enriched where links were found
 * @param visited    detail pages fetched
 * @param enriched   records that gained links from a detail page
 * @param reused     records that took links already stored for them
 * @param storefront records given the source's storefront link as a fallback
 */
public record EnrichmentResult(
    List<CatalogRecord> records,
    int visited,
    int enriched,
    int reused,
    int storefront,
    List<CrawlIssue> issues
) {
    public EnrichmentResult {
        records = records == null ? List.of() : List.copyOf(records);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
