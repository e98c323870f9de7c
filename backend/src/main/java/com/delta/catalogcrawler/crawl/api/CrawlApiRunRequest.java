package com.delta.catalogcrawler.crawl.api;

import java.util.List;

public record CrawlApiRunRequest(
    List<String> sources,
    Integer maxPagesPerSource,
    Integer concurrencyLimit,
    Boolean enableLinkEnrichment,
    Boolean async
) {
}
