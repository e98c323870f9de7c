package com.delta.catalogcrawler.crawl.render;

/**
 * Fetches a URL and returns fully materialized page text.
 */
public interface SourceRenderer {

    RenderMode mode();

    /**
     * @throws FetchException classified as {@link FetchErrorKind#TRANSIENT} for timeouts and connection
     *     failures, {@link FetchErrorKind#PERMANENT} for non-2xx answers and block signals
     */
    FetchedPage fetch(String url) throws FetchException;
}
