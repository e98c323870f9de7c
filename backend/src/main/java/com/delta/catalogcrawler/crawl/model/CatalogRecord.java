package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CatalogRecord(
    String id,
    String sourceId,
    String title,
    String detailUrl,
    String imageUrl,
    Double price,
    String currency,
    String brand,
    String category,
    Map<String, String> purchaseLinks,
    String purchasePlatform,
    Instant capturedAt
) {
    public CatalogRecord {
        purchaseLinks = purchaseLinks == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(purchaseLinks));
    }

    public boolean hasPurchaseLinks() {
        return !purchaseLinks.isEmpty();
    }

    public CatalogRecord withPurchaseLinks(Map<String, String> links, String platform) {
        return new CatalogRecord(
            id,
            sourceId,
            title,
            detailUrl,
            imageUrl,
            price,
            currency,
            brand,
            category,
            links,
            platform,
            capturedAt
        );
    }

    public CatalogRecord withPrice(Double newPrice, String newCurrency) {
        return new CatalogRecord(
            id,
            sourceId,
            title,
            detailUrl,
            imageUrl,
            newPrice,
            newPrice == null ? null : newCurrency,
            brand,
            category,
            purchaseLinks,
            purchasePlatform,
            capturedAt
        );
    }
}
