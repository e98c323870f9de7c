package com.delta.catalogcrawler.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UrlUtils {
    private static final Pattern THUMBNAIL_TOKEN = Pattern.compile("_\\d+x\\d+");
    private static final String LARGE_TOKEN = "_800x0x1";
    private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

    private UrlUtils() {
    }

    /**
     * Resolves {@code href} against {@code baseUrl}. Returns null unless the result is an absolute
     * http(s) URL with a host.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String candidate = href.trim().replace(" ", "%20");
        if (candidate.startsWith("//")) {
            candidate = "https:" + candidate;
        }
        try {
            URI resolved = baseUrl == null || baseUrl.isBlank()
                ? new URI(candidate)
                : new URI(baseUrl.trim()).resolve(candidate);
            String scheme = resolved.getScheme();
            if (scheme == null || resolved.getHost() == null) {
                return null;
            }
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null;
            }
            return resolved.toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String normalizeImageUrl(String baseUrl, String rawImageUrl) {
        if (rawImageUrl == null || rawImageUrl.isBlank() || rawImageUrl.trim().startsWith("data:")) {
            return null;
        }
        String absolute = resolve(baseUrl, rawImageUrl);
        if (absolute == null) {
            return null;
        }
        return upscaleThumbnail(absolute);
    }

    public static String upscaleThumbnail(String imageUrl) {
        return THUMBNAIL_TOKEN.matcher(imageUrl).replaceAll(LARGE_TOKEN);
    }

    public static int pageNumber(String url, int defaultPage) {
        if (url == null) {
            return defaultPage;
        }
        Matcher matcher = PAGE_PARAM.matcher(url);
        if (matcher.find()) {
            try {
                return Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException ignored) {
                return defaultPage;
            }
        }
        return defaultPage;
    }
}
