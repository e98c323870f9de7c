package com.delta.catalogcrawler.crawl.render;

public record FetchedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String body
) {
    public String baseUrl() {
        return finalUrl == null || finalUrl.isBlank() ? requestedUrl : finalUrl;
    }
}
