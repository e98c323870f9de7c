package com.delta.catalogcrawler.crawl.parse;

import java.util.List;

public record ParsedListingPage(List<RawCandidate> candidates, String nextPageUrl, String strategy) {

    public static ParsedListingPage empty(String nextPageUrl) {
        return new ParsedListingPage(List.of(), nextPageUrl, null);
    }

    public boolean hasNextPage() {
        return nextPageUrl != null && !nextPageUrl.isBlank();
    }
}
