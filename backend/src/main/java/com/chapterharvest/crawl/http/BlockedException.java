package com.chapterharvest.crawl.http;

/**
 * The response looked like an anti-bot or challenge page rather than real content.
 */
public class BlockedException extends FetchException {
    private final String reason;

    public BlockedException(String message, String url, String proxyUrl, int statusCode, String reason) {
        super(message, url, proxyUrl, statusCode);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
