package com.delta.catalogcrawler.crawl.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public record LinkShapeListingStrategy(String name, Pattern hrefPattern) implements ListingStrategy {

    @Override
    public List<Element> select(Document document) {
        List<Element> out = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            if (hrefPattern.matcher(anchor.attr("href")).find()) {
                out.add(anchor);
            }
        }
        return out;
    }
}
