package com.delta.catalogcrawler.crawl.enrich;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.persistence.PersistenceSink;
import com.delta.catalogcrawler.crawl.render.FetchErrorKind;
import com.delta.catalogcrawler.crawl.render.FetchException;
import com.delta.catalogcrawler.crawl.render.FetchedPage;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import com.delta.catalogcrawler.crawl.render.SourceRenderer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LinkEnricherTest {
    private static final Source SOURCE = new Source("shop", "Shop", "https://shop.test/albums", null, null, RenderMode.RAW);

    @Test
    void failingRecordDoesNotAffectSiblings() {
        List<CatalogRecord> records = List.of(record(1, null), record(2, null), record(3, null));
        DetailRenderer renderer = new DetailRenderer()
            .page(1, "<p>https://weidian.com/item.html?itemID=111</p>")
            .failure(2, new FetchException(detailUrl(2), FetchErrorKind.TRANSIENT, "timeout", null))
            .crash(3);

        EnrichmentResult result = enricher(10, Map.of()).enrich(SOURCE, records, renderer, () -> false);

        assertThat(result.visited()).isEqualTo(3);
        assertThat(result.enriched()).isEqualTo(1);
        assertThat(result.records().get(0).purchaseLinks()).containsEntry("weidian", "https://weidian.com/item.html?itemID=111");
        assertThat(result.records().get(0).purchasePlatform()).isEqualTo("weidian");
        assertThat(result.records().get(1)).isEqualTo(records.get(1));
        assertThat(result.records().get(2)).isEqualTo(records.get(2));
        assertThat(result.issues()).extracting(issue -> issue.reasonCode())
            .containsExactly("timeout", "enrichment_error");
        assertThat(result.issues()).allSatisfy(issue -> assertThat(issue.scope()).isEqualTo(IssueScope.RECORD));
    }

    @Test
    void visitsAtMostCapDetailPages() {
        List<CatalogRecord> records = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            records.add(record(i, null));
        }
        DetailRenderer renderer = new DetailRenderer();

        EnrichmentResult result = enricher(2, Map.of()).enrich(SOURCE, records, renderer, () -> false);

        assertThat(result.visited()).isEqualTo(2);
        assertThat(renderer.fetched).containsExactly(detailUrl(1), detailUrl(2));
        assertThat(result.records()).hasSize(5);
    }

    @Test
    void storedLinksAreReusedWithoutVisiting() {
        CatalogRecord known = record(1, null);
        Map<String, Map<String, String>> stored = Map.of(known.id(), Map.of("taobao", "https://item.taobao.com/item.htm?id=5"));
        DetailRenderer renderer = new DetailRenderer();

        EnrichmentResult result = enricher(10, stored).enrich(SOURCE, List.of(known, record(2, null)), renderer, () -> false);

        assertThat(result.reused()).isEqualTo(1);
        assertThat(result.records().get(0).purchasePlatform()).isEqualTo("taobao");
        assertThat(renderer.fetched).containsExactly(detailUrl(2));
    }

    @Test
    void storefrontFallbackFillsRecordsWithoutLinks() {
        Source withStorefront = new Source("shop", "Shop", "https://shop.test/albums", "1864913249", null, RenderMode.RAW);
        DetailRenderer renderer = new DetailRenderer()
            .page(1, "<p>https://item.taobao.com/item.htm?id=77</p>");

        EnrichmentResult result = enricher(10, Map.of())
            .enrich(withStorefront, List.of(record(1, null), record(2, null)), renderer, () -> false);

        assertThat(result.storefront()).isEqualTo(1);
        assertThat(result.records().get(0).purchasePlatform()).isEqualTo("taobao");
        assertThat(result.records().get(1).purchaseLinks())
            .containsExactly(Map.entry("weidian", "https://weidian.com/?userid=1864913249"));
        assertThat(result.records().get(1).purchasePlatform()).isEqualTo("weidian");
    }

    @Test
    void descriptionPriceFillsMissingPrice() {
        DetailRenderer renderer = new DetailRenderer()
            .page(1, "<div class=\"showalbum__message\">尺码 S-XL 价格：268</div>")
            .page(2, "<div class=\"showalbum__message\">¥300</div>");

        EnrichmentResult result = enricher(10, Map.of())
            .enrich(SOURCE, List.of(record(1, null), record(2, 150.0)), renderer, () -> false);

        assertThat(result.records().get(0).price()).isEqualTo(268.0);
        assertThat(result.records().get(0).currency()).isEqualTo("CNY");
        assertThat(result.records().get(1).price()).isEqualTo(150.0);
    }

    @Test
    void cancelledRunVisitsNothing() {
        DetailRenderer renderer = new DetailRenderer();

        EnrichmentResult result = enricher(10, Map.of()).enrich(SOURCE, List.of(record(1, null)), renderer, () -> true);

        assertThat(result.visited()).isZero();
        assertThat(renderer.fetched).isEmpty();
    }

    @Test
    void unavailableStoredLinksAreReportedAndEnrichmentContinues() {
        PersistenceSink failingSink = new PersistenceSink() {
            @Override
            public boolean upsert(CatalogRecord record) {
                return true;
            }

            @Override
            public Map<String, Map<String, String>> knownPurchaseLinks(String sourceId) {
                throw new IllegalStateException("db down");
            }
        };
        DetailRenderer renderer = new DetailRenderer().page(1, "https://weidian.com/item.html?itemID=1");
        CrawlerProperties properties = new CrawlerProperties();
        properties.setInterEnrichmentDelayMs(0);

        EnrichmentResult result = new LinkEnricher(failingSink, properties)
            .enrich(SOURCE, List.of(record(1, null)), renderer, () -> false);

        assertThat(result.enriched()).isEqualTo(1);
        assertThat(result.issues()).extracting(issue -> issue.scope()).containsExactly(IssueScope.SOURCE);
    }

    private LinkEnricher enricher(int cap, Map<String, Map<String, String>> stored) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMaxEnrichedRecordsPerSource(cap);
        properties.setInterEnrichmentDelayMs(0);
        PersistenceSink sink = new PersistenceSink() {
            @Override
            public boolean upsert(CatalogRecord record) {
                return true;
            }

            @Override
            public Map<String, Map<String, String>> knownPurchaseLinks(String sourceId) {
                return stored;
            }
        };
        return new LinkEnricher(sink, properties);
    }

    private static CatalogRecord record(int n, Double price) {
        return new CatalogRecord(
            "id-" + n,
            "shop",
            "Album " + n,
            detailUrl(n),
            null,
            price,
            price == null ? null : "CNY",
            null,
            null,
            Map.of(),
            null,
            Instant.parse("2024-03-01T00:00:00Z")
        );
    }

    private static String detailUrl(int n) {
        return "https://shop.test/albums/" + n;
    }

    private static class DetailRenderer implements SourceRenderer {
        private final Map<String, String> pages = new HashMap<>();
        private final Map<String, FetchException> failures = new HashMap<>();
        private final List<String> crashes = new ArrayList<>();
        private final List<String> fetched = new ArrayList<>();

        DetailRenderer page(int n, String body) {
            pages.put(detailUrl(n), body);
            return this;
        }

        DetailRenderer failure(int n, FetchException failure) {
            failures.put(detailUrl(n), failure);
            return this;
        }

        DetailRenderer crash(int n) {
            crashes.add(detailUrl(n));
            return this;
        }

        @Override
        public RenderMode mode() {
            return RenderMode.RAW;
        }

        @Override
        public FetchedPage fetch(String url) throws FetchException {
            fetched.add(url);
            if (failures.containsKey(url)) {
                throw failures.get(url);
            }
            if (crashes.contains(url)) {
                throw new IllegalStateException("renderer crashed");
            }
            return new FetchedPage(url, url, 200, pages.getOrDefault(url, "<html></html>"));
        }
    }
}
