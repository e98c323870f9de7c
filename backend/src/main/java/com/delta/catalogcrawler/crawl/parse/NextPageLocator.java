package com.delta.catalogcrawler.crawl.parse;

import com.delta.catalogcrawler.crawl.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

class NextPageLocator {

    String locate(Document document, String baseUrl) {
        Element pagerNext = document.selectFirst("a.pager__next[href]");
        if (pagerNext != null) {
            String resolved = UrlUtils.resolve(baseUrl, pagerNext.attr("href"));
            if (resolved != null) {
                return resolved;
            }
        }
        int wanted = UrlUtils.pageNumber(baseUrl, 1) + 1;
        for (Element link : document.select("a[href*=page=]")) {
            String href = link.attr("href");
            if (UrlUtils.pageNumber(href, -1) == wanted) {
                String resolved = UrlUtils.resolve(baseUrl, href);
                if (resolved != null) {
                    return resolved;
                }
            }
        }
        return null;
    }
}
