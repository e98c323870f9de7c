package com.delta.catalogcrawler.crawl.render;

public enum RenderMode {
    /** Single HTTP GET, no script execution. */
    RAW,
    /** Headless browser, returns the document after scripts settle. */
    RENDERED
}
