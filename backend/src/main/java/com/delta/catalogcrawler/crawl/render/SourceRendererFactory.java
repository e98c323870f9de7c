package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.config.CrawlerProperties;
import org.springframework.stereotype.Component;

@Component
public class SourceRendererFactory {
    private final HttpSourceRenderer httpSourceRenderer;
    private final CrawlerProperties properties;

    public SourceRendererFactory(HttpSourceRenderer httpSourceRenderer, CrawlerProperties properties) {
        this.httpSourceRenderer = httpSourceRenderer;
        this.properties = properties;
    }

    public RenderSession openSession() {
        return new RenderSession(httpSourceRenderer, () -> new PlaywrightSourceRenderer(properties));
    }
}
