package com.delta.catalogcrawler.crawl.index;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.enrich.PurchaseLinkScanner;
import com.delta.catalogcrawler.crawl.http.PoliteHttpClient;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Pushes records to a Typesense collection through the JSONL bulk import endpoint, one request per
 * batch. Does nothing when no Typesense URL is configured.
 */
@Component
public class TypesenseIndexSink implements IndexSink {
    private static final Logger log = LoggerFactory.getLogger(TypesenseIndexSink.class);
    private static final String API_KEY_HEADER = "X-TYPESENSE-API-KEY";

    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public TypesenseIndexSink(PoliteHttpClient httpClient, CrawlerProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public int index(List<CatalogRecord> records) {
        CrawlerProperties.Index config = properties.getIndex();
        if (!config.isEnabled() || records == null || records.isEmpty()) {
            return 0;
        }
        String importUrl = importUrl(config);
        int indexed = 0;
        int failedBatches = 0;
        for (int start = 0; start < records.size(); start += config.getBatchSize()) {
            List<CatalogRecord> batch = records.subList(start, Math.min(records.size(), start + config.getBatchSize()));
            HttpFetchResult result = httpClient.post(
                importUrl,
                toJsonLines(batch),
                "text/plain",
                "application/json",
                Map.of(API_KEY_HEADER, config.getApiKey() == null ? "" : config.getApiKey())
            );
            if (!result.isSuccessful()) {
                failedBatches++;
                log.warn("Typesense import of {} documents failed: status={} error={}",
                    batch.size(), result.statusCode(), result.errorCode());
                continue;
            }
            indexed += countSuccesses(result.body());
        }
        if (failedBatches > 0) {
            throw new IndexSinkException(failedBatches + " Typesense import batches failed", indexed);
        }
        log.info("Indexed {} of {} records into Typesense collection {}", indexed, records.size(), config.getCollection());
        return indexed;
    }

    String toJsonLines(List<CatalogRecord> batch) {
        StringBuilder out = new StringBuilder();
        for (CatalogRecord record : batch) {
            try {
                out.append(objectMapper.writeValueAsString(toDocument(record))).append('\n');
            } catch (JsonProcessingException e) {
                log.warn("Skipping record {} that could not be serialized", record.id(), e);
            }
        }
        return out.toString();
    }

    ObjectNode toDocument(CatalogRecord record) {
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("id", record.id());
        doc.put("seller", record.sourceId());
        doc.put("title", record.title());
        doc.put("url", record.detailUrl());
        Instant capturedAt = record.capturedAt() == null ? Instant.now() : record.capturedAt();
        doc.put("scraped_at", capturedAt.getEpochSecond());
        putIfPresent(doc, "image_url", record.imageUrl());
        if (record.price() != null) {
            doc.put("price", record.price());
        }
        putIfPresent(doc, "price_currency", record.currency());
        putIfPresent(doc, "brand", record.brand());
        putIfPresent(doc, "category", record.category());
        Map<String, String> links = record.purchaseLinks();
        String platform = record.purchasePlatform();
        if (platform != null && links.containsKey(platform)) {
            doc.put("purchase_platform", platform);
            doc.put("purchase_url", links.get(platform));
        } else if (!links.isEmpty()) {
            Map.Entry<String, String> first = links.entrySet().iterator().next();
            doc.put("purchase_platform", first.getKey());
            doc.put("purchase_url", first.getValue());
        }
        putIfPresent(doc, "weidian_url", links.get(PurchaseLinkScanner.WEIDIAN));
        putIfPresent(doc, "taobao_url", links.get(PurchaseLinkScanner.TAOBAO));
        return doc;
    }

    private int countSuccesses(String body) {
        if (body == null || body.isBlank()) {
            return 0;
        }
        int successes = 0;
        for (String line : body.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(line);
                if (node.path("success").asBoolean(false)) {
                    successes++;
                } else {
                    log.debug("Typesense rejected document: {}", node.path("error").asText());
                }
            } catch (JsonProcessingException e) {
                log.debug("Unreadable Typesense import response line: {}", line);
            }
        }
        return successes;
    }

    private String importUrl(CrawlerProperties.Index config) {
        String base = config.getTypesenseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/collections/" + config.getCollection() + "/documents/import?action=upsert";
    }

    private void putIfPresent(ObjectNode doc, String field, String value) {
        if (value != null && !value.isBlank()) {
            doc.put(field, value);
        }
    }
}
