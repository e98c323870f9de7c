package com.delta.catalogcrawler.crawl.model;

public enum CrawlSessionStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    NO_RECORDS("no_records"),
    FAILED("failed");

    private final String code;

    CrawlSessionStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CrawlSessionStatus fromCode(String code) {
        for (CrawlSessionStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown crawl session status: " + code);
    }
}
