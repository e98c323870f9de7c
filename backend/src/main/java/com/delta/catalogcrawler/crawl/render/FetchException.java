package com.delta.catalogcrawler.crawl.render;

public class FetchException extends Exception {
    private final String url;
    private final FetchErrorKind kind;
    private final String reasonCode;

    public FetchException(String url, FetchErrorKind kind, String reasonCode, String message) {
        this(url, kind, reasonCode, message, null);
    }

    public FetchException(String url, FetchErrorKind kind, String reasonCode, String message, Throwable cause) {
        super(reasonCode + " fetching " + url + (message == null || message.isBlank() ? "" : ": " + message), cause);
        this.url = url;
        this.kind = kind;
        this.reasonCode = reasonCode;
    }

    public String getUrl() {
        return url;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public boolean isPermanent() {
        return kind == FetchErrorKind.PERMANENT;
    }
}
