package com.delta.catalogcrawler.crawl.model;

public enum SourceStage {
    PENDING,
    FETCHING,
    PARSING,
    ENRICHING,
    DONE,
    FAILED;

    public boolean isActive() {
        return this == FETCHING || this == PARSING || this == ENRICHING;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
