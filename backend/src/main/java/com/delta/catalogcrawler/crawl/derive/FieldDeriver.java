package com.delta.catalogcrawler.crawl.derive;

import com.delta.catalogcrawler.crawl.keywords.KeywordProvider;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.parse.RawCandidate;
import com.delta.catalogcrawler.crawl.util.HashUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Derives price, brand and category from a listing title and assembles the record.
 */
@Component
public class FieldDeriver {
    private final KeywordProvider keywordProvider;

    public FieldDeriver(KeywordProvider keywordProvider) {
        this.keywordProvider = keywordProvider;
    }

    public Double derivePrice(String text) {
        return PriceExtractor.extract(text).map(PriceMatch::amount).orElse(null);
    }

    public Optional<PriceMatch> derivePriceMatch(String text) {
        return PriceExtractor.extract(text);
    }

    public String deriveBrand(String text) {
        return keywordProvider.lookupBrand(text).orElse(null);
    }

    public String deriveCategory(String text) {
        return keywordProvider.lookupCategory(text).orElse(null);
    }

    public CatalogRecord assemble(Source source, RawCandidate candidate, Instant capturedAt) {
        String title = candidate.title();
        PriceMatch price = PriceExtractor.extract(title).orElse(null);
        return new CatalogRecord(
            HashUtils.recordId(source.id(), candidate.detailUrl()),
            source.id(),
            title,
            candidate.detailUrl(),
            candidate.imageUrl(),
            price == null ? null : price.amount(),
            price == null ? null : price.currency(),
            deriveBrand(title),
            deriveCategory(title),
            Map.of(),
            null,
            capturedAt
        );
    }
}
