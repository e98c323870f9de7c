package com.delta.catalogcrawler.crawl.enrich;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds marketplace and buying-agent links in raw page text.
 */
public final class PurchaseLinkScanner {
    public static final String WEIDIAN = "weidian";
    public static final String TAOBAO = "taobao";
    public static final String ALIBABA_1688 = "1688";

    /** Platforms that can be the record's primary purchase platform, highest priority first. */
    public static final List<String> PRIMARY_PLATFORMS = List.of(WEIDIAN, TAOBAO, ALIBABA_1688);

    private static final Map<String, List<Pattern>> PATTERNS = buildPatterns();

    private PurchaseLinkScanner() {
    }

    /**
     * Returns the first link found per platform, in platform priority order.
     */
    public static Map<String, String> scan(String body) {
        Map<String, String> links = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            return links;
        }
        for (Map.Entry<String, List<Pattern>> platform : PATTERNS.entrySet()) {
            for (Pattern pattern : platform.getValue()) {
                Matcher matcher = pattern.matcher(body);
                if (matcher.find()) {
                    links.put(platform.getKey(), matcher.group().replace("&amp;", "&"));
                    break;
                }
            }
        }
        return links;
    }

    public static String primaryPlatform(Map<String, String> links) {
        if (links == null) {
            return null;
        }
        for (String platform : PRIMARY_PLATFORMS) {
            if (links.containsKey(platform)) {
                return platform;
            }
        }
        return null;
    }

    private static Map<String, List<Pattern>> buildPatterns() {
        Map<String, List<Pattern>> out = new LinkedHashMap<>();
        out.put(WEIDIAN, compile(
            "https?://(?:www\\.)?weidian\\.com/item\\.html\\?itemID=\\d+",
            "https?://shop\\d+\\.v\\.weidian\\.com/item\\.html\\?itemID=\\d+",
            "https?://(?:www\\.)?weidian\\.com/\\?userid=\\d+"
        ));
        out.put(TAOBAO, compile(
            "https?://item\\.taobao\\.com/item\\.htm\\?[^\"'\\s<>]*id=\\d+",
            "https?://(?:\\w+\\.)?taobao\\.com/[^\"'\\s<>]+",
            "https?://(?:www\\.)?tmall\\.com/[^\"'\\s<>]+"
        ));
        out.put(ALIBABA_1688, compile(
            "https?://detail\\.1688\\.com/offer/\\d+\\.html",
            "https?://(?:www\\.)?1688\\.com/[^\"'\\s<>]+"
        ));
        out.put("pandabuy", compile("https?://(?:www\\.)?pandabuy\\.com/product\\?[^\"'\\s<>]+"));
        out.put("superbuy", compile("https?://(?:www\\.)?superbuy\\.com/[^\"'\\s<>]+"));
        out.put("wegobuy", compile("https?://(?:www\\.)?wegobuy\\.com/[^\"'\\s<>]+"));
        out.put("cssbuy", compile("https?://(?:www\\.)?cssbuy\\.com/[^\"'\\s<>]+"));
        return out;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }
}
