package com.delta.catalogcrawler.crawl.derive;

public record PriceMatch(double amount, String currency) {}
