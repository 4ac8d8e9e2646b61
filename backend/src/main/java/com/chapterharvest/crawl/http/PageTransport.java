package com.chapterharvest.crawl.http;

import com.chapterharvest.crawl.model.HttpFetchResult;

import java.time.Duration;
import java.util.Map;

/**
 * Single HTTP GET over an optional relay. Implementations report failures through
 * {@link HttpFetchResult#errorCode()} instead of throwing.
 */
public interface PageTransport {
    HttpFetchResult get(String url, String proxyUrl, Map<String, String> headers, Duration timeout);
}
