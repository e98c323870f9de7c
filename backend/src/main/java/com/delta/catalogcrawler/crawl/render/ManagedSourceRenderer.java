package com.delta.catalogcrawler.crawl.render;

/**
 * A renderer that owns an expensive execution context and must be released.
 */
public interface ManagedSourceRenderer extends SourceRenderer, AutoCloseable {

    @Override
    void close();
}
