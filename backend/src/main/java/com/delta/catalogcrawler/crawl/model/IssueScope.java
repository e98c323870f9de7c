package com.delta.catalogcrawler.crawl.model;

public enum IssueScope {
    PAGE,
    RECORD,
    SOURCE,
    RUN
}
