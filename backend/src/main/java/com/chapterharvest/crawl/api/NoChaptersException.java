package com.chapterharvest.crawl.api;

public class NoChaptersException extends RuntimeException {
    public NoChaptersException(String message) {
        super(message);
    }
}
