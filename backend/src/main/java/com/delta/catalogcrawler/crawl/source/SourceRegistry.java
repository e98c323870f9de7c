package com.delta.catalogcrawler.crawl.source;

import com.delta.catalogcrawler.crawl.model.Source;

import java.util.List;
import java.util.Optional;

public interface SourceRegistry {

    List<Source> allSources();

    Optional<Source> findSource(String sourceId);

    /**
     * Resolves the given ids in order; an empty list selects every registered source.
     *
     * @throws UnknownSourceException when any id is not registered
     */
    default List<Source> findSources(List<String> sourceIds) {
        if (sourceIds == null || sourceIds.isEmpty()) {
            return allSources();
        }
        return sourceIds.stream()
            .map(id -> findSource(id).orElseThrow(() -> new UnknownSourceException(id)))
            .toList();
    }
}
