package com.delta.catalogcrawler.crawl.enrich;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PurchaseLinkScannerTest {

    @Test
    void findsFirstLinkPerPlatformInPriorityOrder() {
        String body = """
            <div class="showalbum__message">
              Buy here: <a href="https://item.taobao.com/item.htm?spm=a1z10&amp;id=6123">taobao</a>
              or https://weidian.com/item.html?itemID=4455 or https://weidian.com/item.html?itemID=9999
              agent: https://www.pandabuy.com/product?url=abc
            </div>
            """;

        Map<String, String> links = PurchaseLinkScanner.scan(body);

        assertThat(links.keySet()).containsExactly("weidian", "taobao", "pandabuy");
        assertEquals("https://weidian.com/item.html?itemID=4455", links.get("weidian"));
        assertEquals("https://item.taobao.com/item.htm?spm=a1z10&id=6123", links.get("taobao"));
        assertEquals("weidian", PurchaseLinkScanner.primaryPlatform(links));
    }

    @Test
    void agentOnlyLinksHaveNoPrimaryPlatform() {
        Map<String, String> links = PurchaseLinkScanner.scan("https://www.superbuy.com/en/page/buy?url=x");

        assertThat(links).containsOnlyKeys("superbuy");
        assertNull(PurchaseLinkScanner.primaryPlatform(links));
    }

    @Test
    void blankBodyHasNoLinks() {
        assertThat(PurchaseLinkScanner.scan("")).isEmpty();
        assertThat(PurchaseLinkScanner.scan(null)).isEmpty();
    }
}
