package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record ProbeResult(
    String sourceId,
    String url,
    boolean reachable,
    int statusCode,
    String errorCode,
    Instant probedAt
) {}
