package com.delta.catalogcrawler.crawl.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.List;

/**
 * Looks up a container (or the whole document when {@code containerSelector} is null) and returns the
 * anchors of the first item selector that matches anything inside it.
 */
public record ContainerListingStrategy(
    String name,
    String containerSelector,
    List<String> itemSelectors
) implements ListingStrategy {

    @Override
    public List<Element> select(Document document) {
        Element scope = containerSelector == null ? document : document.selectFirst(containerSelector);
        if (scope == null) {
            return List.of();
        }
        for (String itemSelector : itemSelectors) {
            Elements items = scope.select(itemSelector);
            if (!items.isEmpty()) {
                return items;
            }
        }
        return List.of();
    }
}
