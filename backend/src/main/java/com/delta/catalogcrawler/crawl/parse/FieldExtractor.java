package com.delta.catalogcrawler.crawl.parse;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.function.Function;

/**
 * Named attempt at reading one field from a listing anchor. Chains are evaluated in order and the first
 * non-blank value wins.
 */
public record FieldExtractor(String name, Function<Element, String> reader) {

    public static String firstNonBlank(List<FieldExtractor> chain, Element anchor) {
        for (FieldExtractor extractor : chain) {
            String value = extractor.reader().apply(anchor);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
