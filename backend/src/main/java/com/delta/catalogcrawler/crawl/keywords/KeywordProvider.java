package com.delta.catalogcrawler.crawl.keywords;

import java.util.Optional;

/**
 * Source of the brand and category alias tables used by field derivation.
 */
public interface KeywordProvider {

    Optional<String> lookupBrand(String text);

    Optional<String> lookupCategory(String text);

    /**
     * Re-reads the backing tables. Lookups running concurrently see either the old or the new tables.
     */
    default void reload() {
    }
}
