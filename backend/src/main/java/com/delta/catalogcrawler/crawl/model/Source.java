package com.delta.catalogcrawler.crawl.model;

import com.delta.catalogcrawler.crawl.render.RenderMode;

/**
 * A listing owner to crawl. Supplied by the source registry and read-only for the duration of a run.
 */
public record Source(
    String id,
    String displayName,
    String listingUrl,
    String weidianId,
    String taobaoShop,
    RenderMode renderMode
) {
    public String storefrontUrl() {
        if (weidianId == null || weidianId.isBlank()) {
            return null;
        }
        return "https://weidian.com/?userid=" + weidianId.trim();
    }

    public String label() {
        return displayName == null || displayName.isBlank() ? id : displayName + " (" + id + ")";
    }
}
