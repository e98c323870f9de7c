package com.delta.catalogcrawler.crawl.keywords;

/**
 * One alias and the canonical value it maps to, e.g. {@code "air max" -> "Nike"}.
 */
public record KeywordEntry(String keyword, String value) {}
