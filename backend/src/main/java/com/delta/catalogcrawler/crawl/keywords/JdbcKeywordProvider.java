package com.delta.catalogcrawler.crawl.keywords;

import com.delta.catalogcrawler.crawl.persistence.CatalogJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Keyword tables backed by the keyword_mappings table. A kind with no rows falls back to the built-in
 * table. Tables are swapped atomically on reload.
 */
@Component
public class JdbcKeywordProvider implements KeywordProvider {
    private static final Logger log = LoggerFactory.getLogger(JdbcKeywordProvider.class);

    private final CatalogJdbcRepository repository;
    private volatile KeywordTable brands = DefaultKeywordTables.brands();
    private volatile KeywordTable categories = DefaultKeywordTables.categories();

    public JdbcKeywordProvider(CatalogJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<String> lookupBrand(String text) {
        return brands.lookup(text);
    }

    @Override
    public Optional<String> lookupCategory(String text) {
        return categories.lookup(text);
    }

    @Override
    @Scheduled(
        initialDelayString = "${crawler.keywords.refresh-ms:300000}",
        fixedDelayString = "${crawler.keywords.refresh-ms:300000}"
    )
    public void reload() {
        try {
            KeywordTable loadedBrands = load(KeywordKind.BRAND);
            KeywordTable loadedCategories = load(KeywordKind.CATEGORY);
            brands = loadedBrands;
            categories = loadedCategories;
            log.debug("Keyword tables reloaded: {} brand aliases, {} category aliases",
                loadedBrands.size(), loadedCategories.size());
        } catch (DataAccessException e) {
            log.warn("Keyword reload failed; keeping previous tables", e);
        }
    }

    KeywordTable brands() {
        return brands;
    }

    KeywordTable categories() {
        return categories;
    }

    private KeywordTable load(KeywordKind kind) {
        List<KeywordEntry> rows = repository.findKeywordMappings(kind);
        KeywordTable table = new KeywordTable(rows);
        return table.isEmpty() ? DefaultKeywordTables.forKind(kind) : table;
    }
}
