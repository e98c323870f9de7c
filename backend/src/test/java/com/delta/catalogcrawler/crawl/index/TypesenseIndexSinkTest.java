package com.delta.catalogcrawler.crawl.index;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.http.PoliteHttpClient;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypesenseIndexSinkTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        properties.getIndex().setTypesenseUrl(server.url("/").toString());
        properties.getIndex().setApiKey("secret");
        properties.getIndex().setCollection("products");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void importsBatchesAsJsonLines() throws Exception {
        properties.getIndex().setBatchSize(2);
        server.enqueue(new MockResponse().setBody("{\"success\":true}\n{\"success\":true}"));
        server.enqueue(new MockResponse().setBody("{\"success\":false,\"error\":\"bad doc\"}"));

        int indexed = sink().index(List.of(record("a", null), record("b", null), record("c", null)));

        assertThat(indexed).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
        RecordedRequest first = server.takeRequest();
        assertThat(first.getMethod()).isEqualTo("POST");
        assertThat(first.getPath()).isEqualTo("/collections/products/documents/import?action=upsert");
        assertThat(first.getHeader("X-TYPESENSE-API-KEY")).isEqualTo("secret");
        String[] lines = first.getBody().readUtf8().trim().split("\n");
        assertThat(lines).hasSize(2);
        assertThat(objectMapper.readTree(lines[0]).path("seller").asText()).isEqualTo("shop");
    }

    @Test
    void failedBatchReportsPartialCount() {
        properties.getIndex().setBatchSize(1);
        server.enqueue(new MockResponse().setBody("{\"success\":true}"));
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> sink().index(List.of(record("a", null), record("b", null))))
            .isInstanceOfSatisfying(IndexSinkException.class, e -> assertThat(e.getIndexed()).isEqualTo(1));
    }

    @Test
    void disabledIndexSendsNothing() {
        properties.getIndex().setTypesenseUrl("");

        assertThat(sink().index(List.of(record("a", null)))).isZero();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void documentCarriesPurchaseFields() {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("weidian", "https://weidian.com/item.html?itemID=1");
        links.put("taobao", "https://item.taobao.com/item.htm?id=2");
        CatalogRecord record = record("a", links).withPrice(199.0, "CNY");

        JsonNode doc = sink().toDocument(record);

        assertThat(doc.path("id").asText()).isEqualTo("a");
        assertThat(doc.path("url").asText()).isEqualTo("https://shop.test/albums/a");
        assertThat(doc.path("scraped_at").asLong()).isEqualTo(1709251200L);
        assertThat(doc.path("price").asDouble()).isEqualTo(199.0);
        assertThat(doc.path("price_currency").asText()).isEqualTo("CNY");
        assertThat(doc.path("purchase_platform").asText()).isEqualTo("weidian");
        assertThat(doc.path("purchase_url").asText()).isEqualTo("https://weidian.com/item.html?itemID=1");
        assertThat(doc.path("taobao_url").asText()).isEqualTo("https://item.taobao.com/item.htm?id=2");
        assertThat(doc.has("brand")).isFalse();
    }

    private TypesenseIndexSink sink() {
        return new TypesenseIndexSink(new PoliteHttpClient(properties, executor), properties, objectMapper);
    }

    private static CatalogRecord record(String id, Map<String, String> links) {
        return new CatalogRecord(
            id,
            "shop",
            "Album " + id,
            "https://shop.test/albums/" + id,
            null,
            null,
            null,
            null,
            null,
            links,
            links == null ? null : "weidian",
            Instant.parse("2024-03-01T00:00:00Z")
        );
    }
}
