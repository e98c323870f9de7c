package com.delta.catalogcrawler.crawl.parse;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns listing markup into candidates plus an optional next-page URL. Listing markup has no schema, so
 * strategies are tried in order and the first one producing at least one usable candidate wins.
 */
@Component
public class ListingPageParser {
    public static final String UNKNOWN_TITLE = "Unknown";

    private static final Pattern LEADING_IMAGE_COUNT = Pattern.compile("^\\d+\\s+");
    private static final Pattern BACKGROUND_URL = Pattern.compile("url\\([\"']?([^\"')\\s]+)[\"']?\\)");

    private final Pattern detailPathPattern;
    private final int maxTitleLength;
    private final List<ListingStrategy> strategies;
    private final List<FieldExtractor> titleExtractors;
    private final List<FieldExtractor> imageExtractors;
    private final NextPageLocator nextPageLocator = new NextPageLocator();

    public ListingPageParser(CrawlerProperties properties) {
        this.detailPathPattern = Pattern.compile(properties.getParsing().getDetailPathPattern());
        this.maxTitleLength = properties.getParsing().getMaxTitleLength();
        this.strategies = defaultStrategies(detailPathPattern);
        this.titleExtractors = defaultTitleExtractors();
        this.imageExtractors = defaultImageExtractors();
    }

    public static List<ListingStrategy> defaultStrategies(Pattern detailPathPattern) {
        return List.of(
            new ContainerListingStrategy("showindex_container", "div.showindex__children", List.of("a.album__main", "a[href]")),
            new ContainerListingStrategy("categories_container", "div.categories__children", List.of("a[href]")),
            new ContainerListingStrategy("album_class", null, List.of("a.album__main")),
            new LinkShapeListingStrategy("detail_link_shape", detailPathPattern)
        );
    }

    public List<ListingStrategy> strategies() {
        return strategies;
    }

    public ParsedListingPage parse(String body, String baseUrl) {
        if (body == null || body.isBlank()) {
            return ParsedListingPage.empty(null);
        }
        Document document = Jsoup.parse(body, baseUrl == null ? "" : baseUrl);
        String nextPageUrl = nextPageLocator.locate(document, baseUrl);
        for (ListingStrategy strategy : strategies) {
            List<RawCandidate> candidates = toCandidates(strategy.select(document), baseUrl);
            if (!candidates.isEmpty()) {
                return new ParsedListingPage(candidates, nextPageUrl, strategy.name());
            }
        }
        return ParsedListingPage.empty(nextPageUrl);
    }

    private List<RawCandidate> toCandidates(List<Element> anchors, String baseUrl) {
        List<RawCandidate> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element anchor : anchors) {
            String detailUrl = detailUrl(anchor, baseUrl);
            if (detailUrl == null || !seen.add(detailUrl)) {
                continue;
            }
            out.add(new RawCandidate(detailUrl, title(anchor), image(anchor, baseUrl)));
        }
        return out;
    }

    private String detailUrl(Element anchor, String baseUrl) {
        String href = anchor.attr("href");
        if (href.isBlank() || !detailPathPattern.matcher(href).find()) {
            return null;
        }
        return UrlUtils.resolve(baseUrl, href);
    }

    String title(Element anchor) {
        String title = FieldExtractor.firstNonBlank(titleExtractors, anchor);
        if (title == null) {
            return UNKNOWN_TITLE;
        }
        if (title.codePointCount(0, title.length()) <= maxTitleLength) {
            return title;
        }
        return title.substring(0, title.offsetByCodePoints(0, maxTitleLength));
    }

    private String image(Element anchor, String baseUrl) {
        return UrlUtils.normalizeImageUrl(baseUrl, FieldExtractor.firstNonBlank(imageExtractors, anchor));
    }

    private static List<FieldExtractor> defaultTitleExtractors() {
        return List.of(
            new FieldExtractor("title_element", anchor -> {
                Element titleElement = anchor.selectFirst(".album__title");
                return titleElement == null ? null : titleElement.text();
            }),
            new FieldExtractor("title_attribute", anchor -> anchor.attr("title")),
            new FieldExtractor("image_alt", anchor -> {
                Element img = anchor.selectFirst("img[alt]");
                return img == null ? null : img.attr("alt");
            }),
            new FieldExtractor("anchor_text", anchor -> LEADING_IMAGE_COUNT.matcher(anchor.text().trim()).replaceFirst(""))
        );
    }

    private static List<FieldExtractor> defaultImageExtractors() {
        return List.of(
            imageAttribute("data-origin-src"),
            imageAttribute("data-src"),
            imageAttribute("src"),
            new FieldExtractor("cover_background", anchor -> {
                Element cover = anchor.selectFirst(".album__cover[style]");
                if (cover == null) {
                    return null;
                }
                Matcher matcher = BACKGROUND_URL.matcher(cover.attr("style"));
                return matcher.find() ? matcher.group(1) : null;
            })
        );
    }

    private static FieldExtractor imageAttribute(String attribute) {
        return new FieldExtractor("img_" + attribute, anchor -> {
            Element img = anchor.selectFirst("img[" + attribute + "]");
            if (img == null) {
                return null;
            }
            String value = img.attr(attribute);
            return value.startsWith("data:") ? null : value;
        });
    }
}
