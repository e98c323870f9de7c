package com.delta.catalogcrawler.crawl.model;

import java.util.ArrayList;
import java.util.List;

public record CrawlRunRequest(
    List<String> sourceIds,
    Integer maxPagesPerSource,
    Integer concurrencyLimit,
    Boolean enableLinkEnrichment
) {
    public static CrawlRunRequest defaults() {
        return new CrawlRunRequest(List.of(), null, null, null);
    }

    public List<String> normalizedSourceIds() {
        if (sourceIds == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String sourceId : sourceIds) {
            if (sourceId == null) {
                continue;
            }
            String normalized = sourceId.trim();
            if (!normalized.isEmpty() && !out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }
}
