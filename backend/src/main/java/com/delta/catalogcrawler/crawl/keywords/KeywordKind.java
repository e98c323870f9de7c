package com.delta.catalogcrawler.crawl.keywords;

import java.util.Locale;

public enum KeywordKind {
    BRAND,
    CATEGORY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static KeywordKind fromCode(String code) {
        return KeywordKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
