package com.delta.catalogcrawler.crawl.parse;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * One structural way of locating listing anchors on a page.
 */
public interface ListingStrategy {

    String name();

    List<Element> select(Document document);
}
