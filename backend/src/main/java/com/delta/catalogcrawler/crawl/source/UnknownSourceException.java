package com.delta.catalogcrawler.crawl.source;

public class UnknownSourceException extends RuntimeException {
    private final String sourceId;

    public UnknownSourceException(String sourceId) {
        super("Unknown source: " + sourceId);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
