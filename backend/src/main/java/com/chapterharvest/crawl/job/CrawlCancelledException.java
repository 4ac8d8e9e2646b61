package com.chapterharvest.crawl.job;

public class CrawlCancelledException extends RuntimeException {
    public CrawlCancelledException(String message) {
        super(message);
    }
}
