package com.delta.catalogcrawler.crawl.derive;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a plausible price in free text. Patterns are tried in order; the first one whose match parses
 * and lies in [{@value #MIN_PRICE}, {@value #MAX_PRICE}] wins.
 */
public final class PriceExtractor {
    public static final double MIN_PRICE = 1;
    public static final double MAX_PRICE = 50_000;
    public static final String CNY = "CNY";
    public static final String USD = "USD";

    private static final String AMOUNT = "(\\d+(?:\\.\\d{1,2})?)";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<PricePattern> PATTERNS = List.of(
        new PricePattern(Pattern.compile("[¥￥]\\s*" + AMOUNT, FLAGS), CNY),
        new PricePattern(Pattern.compile(AMOUNT + "\\s*[¥￥]", FLAGS), CNY),
        new PricePattern(Pattern.compile("CNY\\s*" + AMOUNT, FLAGS), CNY),
        new PricePattern(Pattern.compile(AMOUNT + "\\s*CNY", FLAGS), CNY),
        new PricePattern(Pattern.compile("RMB\\s*" + AMOUNT, FLAGS), CNY),
        new PricePattern(Pattern.compile(AMOUNT + "\\s*RMB", FLAGS), CNY),
        new PricePattern(Pattern.compile("Yuan\\s*" + AMOUNT, FLAGS), CNY),
        new PricePattern(Pattern.compile(AMOUNT + "\\s*Yuan", FLAGS), CNY),
        new PricePattern(Pattern.compile("\\$\\s*" + AMOUNT, FLAGS), USD),
        new PricePattern(Pattern.compile(AMOUNT + "\\s*\\$", FLAGS), USD),
        new PricePattern(Pattern.compile("(?:price|价格)[:：\\s]*" + AMOUNT, FLAGS), CNY)
    );

    private PriceExtractor() {
    }

    public static Optional<PriceMatch> extract(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (PricePattern pricePattern : PATTERNS) {
            Matcher matcher = pricePattern.pattern().matcher(text);
            if (!matcher.find()) {
                continue;
            }
            try {
                double amount = Double.parseDouble(matcher.group(1));
                if (amount >= MIN_PRICE && amount <= MAX_PRICE) {
                    return Optional.of(new PriceMatch(amount, pricePattern.currency()));
                }
            } catch (NumberFormatException ignored) {
                // try the next pattern
            }
        }
        return Optional.empty();
    }

    private record PricePattern(Pattern pattern, String currency) {}
}
