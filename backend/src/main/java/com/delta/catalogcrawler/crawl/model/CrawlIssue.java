package com.delta.catalogcrawler.crawl.model;

/**
 * Diagnostic for a failure that was absorbed instead of propagated.
 */
public record CrawlIssue(
    String sourceId,
    IssueScope scope,
    String url,
    String reasonCode,
    String message
) {
    public String describe() {
        StringBuilder out = new StringBuilder();
        if (sourceId != null) {
            out.append(sourceId).append(": ");
        }
        out.append(reasonCode);
        if (url != null) {
            out.append(" at ").append(url);
        }
        if (message != null && !message.isBlank()) {
            out.append(" (").append(message).append(')');
        }
        return out.toString();
    }
}
