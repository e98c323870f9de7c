package com.delta.catalogcrawler.crawl.index;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;

import java.util.List;

/**
 * Best-effort hand-off of records to a search index.
 */
public interface IndexSink {

    /**
     * @return number of records the index accepted
     * @throws IndexSinkException when some or all records could not be indexed
     */
    int index(List<CatalogRecord> records);
}
