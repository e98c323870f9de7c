package com.delta.catalogcrawler.crawl.render;

public enum FetchErrorKind {
    /** Timeouts, resets and other failures that may succeed on a later run. */
    TRANSIENT,
    /** Non-2xx answers, block signals and malformed URLs. */
    PERMANENT
}
