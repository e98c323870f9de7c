package com.delta.catalogcrawler.crawl.walk;

public enum WalkTermination {
    EXHAUSTED,
    MAX_PAGES_REACHED,
    EMPTY_FIRST_PAGE,
    FETCH_ERROR,
    CANCELLED
}
