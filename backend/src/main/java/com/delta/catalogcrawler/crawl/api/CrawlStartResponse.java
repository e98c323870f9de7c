package com.delta.catalogcrawler.crawl.api;

public record CrawlStartResponse(Long crawlRunId, String status) {
}
