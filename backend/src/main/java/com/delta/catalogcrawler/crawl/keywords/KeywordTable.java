package com.delta.catalogcrawler.crawl.keywords;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered alias table. Lookup is a case-insensitive substring match and the earliest entry wins, so
 * declaration order decides between values whose aliases both occur in the text.
 */
public final class KeywordTable {
    private final List<KeywordEntry> entries;

    public KeywordTable(List<KeywordEntry> entries) {
        List<KeywordEntry> normalized = new ArrayList<>();
        if (entries != null) {
            for (KeywordEntry entry : entries) {
                if (entry == null || entry.keyword() == null || entry.keyword().isBlank()
                    || entry.value() == null || entry.value().isBlank()) {
                    continue;
                }
                normalized.add(new KeywordEntry(entry.keyword().trim().toLowerCase(Locale.ROOT), entry.value().trim()));
            }
        }
        this.entries = List.copyOf(normalized);
    }

    public static KeywordTable empty() {
        return new KeywordTable(List.of());
    }

    public Optional<String> lookup(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        for (KeywordEntry entry : entries) {
            if (haystack.contains(entry.keyword())) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    public List<KeywordEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
