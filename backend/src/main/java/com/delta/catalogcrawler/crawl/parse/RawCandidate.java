package com.delta.catalogcrawler.crawl.parse;

/**
 * One listing entry as found on a page, before any field derivation.
 */
public record RawCandidate(String detailUrl, String title, String imageUrl) {}
