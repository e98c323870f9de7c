package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.crawl.http.PoliteHttpClient;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import com.delta.catalogcrawler.crawl.model.ProbeResult;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.source.SourceRegistry;
import com.delta.catalogcrawler.crawl.source.UnknownSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Checks whether a source's listing URL answers with a 2xx status, without parsing anything.
 */
@Service
public class SourceProbeService {
    private static final Logger log = LoggerFactory.getLogger(SourceProbeService.class);

    private final SourceRegistry sourceRegistry;
    private final PoliteHttpClient httpClient;

    public SourceProbeService(SourceRegistry sourceRegistry, PoliteHttpClient httpClient) {
        this.sourceRegistry = sourceRegistry;
        this.httpClient = httpClient;
    }

    public ProbeResult probe(String sourceId) {
        Source source = sourceRegistry.findSource(sourceId).orElseThrow(() -> new UnknownSourceException(sourceId));
        return probe(source);
    }

    public ProbeResult probe(Source source) {
        HttpFetchResult result = httpClient.get(source.listingUrl(), "text/html,*/*;q=0.8");
        boolean reachable = result.isSuccessful();
        log.info("Probe of {} at {}: status={} error={}", source.id(), source.listingUrl(), result.statusCode(), result.errorCode());
        return new ProbeResult(
            source.id(),
            source.listingUrl(),
            reachable,
            result.statusCode(),
            result.errorCode(),
            Instant.now()
        );
    }
}
