package com.delta.catalogcrawler.crawl.enrich;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.derive.PriceExtractor;
import com.delta.catalogcrawler.crawl.derive.PriceMatch;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.persistence.PersistenceSink;
import com.delta.catalogcrawler.crawl.render.FetchException;
import com.delta.catalogcrawler.crawl.render.FetchedPage;
import com.delta.catalogcrawler.crawl.render.SourceRenderer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Second pass over a source's records: visits detail pages to recover purchase links. A failure on one
 * record is recorded and never affects its siblings.
 */
@Component
public class LinkEnricher {
    private static final Logger log = LoggerFactory.getLogger(LinkEnricher.class);
    private static final String DESCRIPTION_SELECTOR = ".showalbum__message";

    private final PersistenceSink persistenceSink;
    private final CrawlerProperties properties;

    public LinkEnricher(PersistenceSink persistenceSink, CrawlerProperties properties) {
        this.persistenceSink = persistenceSink;
        this.properties = properties;
    }

    public EnrichmentResult enrich(
        Source source,
        List<CatalogRecord> records,
        SourceRenderer renderer,
        BooleanSupplier cancelled
    ) {
        List<CrawlIssue> issues = new ArrayList<>();
        List<CatalogRecord> out = new ArrayList<>(records);
        Map<String, Map<String, String>> known = loadKnownLinks(source, issues);

        int reused = 0;
        for (int i = 0; i < out.size(); i++) {
            CatalogRecord record = out.get(i);
            Map<String, String> stored = known.get(record.id());
            if (!record.hasPurchaseLinks() && stored != null && !stored.isEmpty()) {
                out.set(i, record.withPurchaseLinks(stored, PurchaseLinkScanner.primaryPlatform(stored)));
                reused++;
            }
        }

        int cap = properties.getMaxEnrichedRecordsPerSource();
        int visited = 0;
        int enriched = 0;
        for (int i = 0; i < out.size() && visited < cap; i++) {
            CatalogRecord record = out.get(i);
            if (record.hasPurchaseLinks()) {
                continue;
            }
            if (cancelled.getAsBoolean()) {
                log.info("Enrichment of {} cancelled after {} visits", source.id(), visited);
                break;
            }
            if (visited > 0 && !pause(properties.getInterEnrichmentDelayMs())) {
                break;
            }
            visited++;
            try {
                CatalogRecord updated = enrichOne(record, renderer);
                if (updated.hasPurchaseLinks()) {
                    enriched++;
                }
                out.set(i, updated);
            } catch (FetchException e) {
                issues.add(new CrawlIssue(source.id(), IssueScope.RECORD, record.detailUrl(), e.getReasonCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Enrichment failed for {} record {}", source.id(), record.detailUrl(), e);
                issues.add(new CrawlIssue(source.id(), IssueScope.RECORD, record.detailUrl(), "enrichment_error", e.getMessage()));
            }
        }

        int storefront = applyStorefrontFallback(source, out);
        log.info("Enrichment of {}: {} visits, {} enriched, {} reused, {} storefront fallbacks, {} issues",
            source.id(), visited, enriched, reused, storefront, issues.size());
        return new EnrichmentResult(out, visited, enriched, reused, storefront, issues);
    }

    CatalogRecord enrichOne(CatalogRecord record, SourceRenderer renderer) throws FetchException {
        FetchedPage page = renderer.fetch(record.detailUrl());
        Map<String, String> links = PurchaseLinkScanner.scan(page.body());
        CatalogRecord updated = record;
        if (!links.isEmpty()) {
            updated = updated.withPurchaseLinks(links, PurchaseLinkScanner.primaryPlatform(links));
        }
        if (updated.price() == null) {
            PriceMatch price = descriptionPrice(page.body());
            if (price != null) {
                updated = updated.withPrice(price.amount(), price.currency());
            }
        }
        return updated;
    }

    private PriceMatch descriptionPrice(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        Element description = Jsoup.parse(body).selectFirst(DESCRIPTION_SELECTOR);
        if (description == null) {
            return null;
        }
        return PriceExtractor.extract(description.text()).orElse(null);
    }

    private int applyStorefrontFallback(Source source, List<CatalogRecord> records) {
        String storefrontUrl = source.storefrontUrl();
        if (storefrontUrl == null) {
            return 0;
        }
        int applied = 0;
        for (int i = 0; i < records.size(); i++) {
            CatalogRecord record = records.get(i);
            if (!record.hasPurchaseLinks()) {
                records.set(i, record.withPurchaseLinks(
                    Map.of(PurchaseLinkScanner.WEIDIAN, storefrontUrl),
                    PurchaseLinkScanner.WEIDIAN
                ));
                applied++;
            }
        }
        return applied;
    }

    private Map<String, Map<String, String>> loadKnownLinks(Source source, List<CrawlIssue> issues) {
        try {
            return persistenceSink.knownPurchaseLinks(source.id());
        } catch (RuntimeException e) {
            log.warn("Unable to load stored purchase links for {}", source.id(), e);
            issues.add(new CrawlIssue(source.id(), IssueScope.SOURCE, null, "known_links_unavailable", e.getMessage()));
            return Map.of();
        }
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
