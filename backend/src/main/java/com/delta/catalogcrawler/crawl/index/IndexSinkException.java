package com.delta.catalogcrawler.crawl.index;

public class IndexSinkException extends RuntimeException {
    private final int indexed;

    public IndexSinkException(String message, int indexed) {
        super(message);
        this.indexed = indexed;
    }

    public int getIndexed() {
        return indexed;
    }
}
