package com.delta.catalogcrawler.crawl.model;

public enum RunStatus {
    IDLE,
    RUNNING
}
