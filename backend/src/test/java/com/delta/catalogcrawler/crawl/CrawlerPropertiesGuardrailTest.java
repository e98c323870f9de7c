package com.delta.catalogcrawler.crawl;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyPagesAndDelaysAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setConcurrencyLimit(0);
        properties.setMaxPagesPerSource(-3);
        properties.setPerHostDelayMs(-10);
        properties.setInterPageDelayMs(-1);
        properties.setMaxEnrichedRecordsPerSource(-5);
        assertEquals(1, properties.getConcurrencyLimit());
        assertEquals(1, properties.getMaxPagesPerSource());
        assertEquals(0, properties.getPerHostDelayMs());
        assertEquals(0, properties.getInterPageDelayMs());
        assertEquals(0, properties.getMaxEnrichedRecordsPerSource());
    }

    @Test
    void renderTimeoutNeverUndercutsRequestTimeout() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(20);
        properties.setRenderTimeoutSeconds(5);
        assertEquals(21, properties.getRenderTimeoutSeconds());
    }

    @Test
    void enrichmentRenderModeFollowsDefaultWhenUnset() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setDefaultRenderMode(RenderMode.RAW);
        properties.setEnrichmentRenderMode(null);
        assertEquals(RenderMode.RAW, properties.getEnrichmentRenderMode());
    }

    @Test
    void indexIsDisabledWithoutUrl() {
        CrawlerProperties properties = new CrawlerProperties();
        assertFalse(properties.getIndex().isEnabled());
        properties.getIndex().setTypesenseUrl("http://localhost:8108");
        assertTrue(properties.getIndex().isEnabled());
    }
}
