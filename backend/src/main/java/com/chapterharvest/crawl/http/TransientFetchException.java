package com.chapterharvest.crawl.http;

/**
 * Timeout, connection failure or non-2xx status. Soft failure against the proxy that carried it.
 */
public class TransientFetchException extends FetchException {
    private final String errorCode;

    public TransientFetchException(String message, String url, String proxyUrl, int statusCode, String errorCode) {
        super(message, url, proxyUrl, statusCode);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
