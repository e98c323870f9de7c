package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable store for catalog records. Upserts are idempotent by record id.
 */
public interface PersistenceSink {

    /**
     * Inserts or updates the record. Empty purchase links never erase links already stored, and the
     * original capture time is kept on update.
     *
     * @return true when a row was written
     */
    boolean upsert(CatalogRecord record);

    /**
     * Stored versions of the given records, after merging with earlier crawls. Ids with no row are
     * absent from the result.
     */
    default List<CatalogRecord> findRecords(Collection<String> ids) {
        return List.of();
    }

    /**
     * Purchase links already stored for the source, keyed by record id.
     */
    default Map<String, Map<String, String>> knownPurchaseLinks(String sourceId) {
        return Map.of();
    }
}
