package com.chapterharvest.crawl.http;

/**
 * A logical fetch that failed after its attempt budget. Carries the last attempt's route and outcome.
 */
public class FetchException extends RuntimeException {
    private final String url;
    private final String proxyUrl;
    private final int statusCode;

    public FetchException(String message, String url, String proxyUrl, int statusCode) {
        super(message);
        this.url = url;
        this.proxyUrl = proxyUrl;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    public String getProxyUrl() {
        return proxyUrl;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
