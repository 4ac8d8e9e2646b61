package com.chapterharvest.crawl.extract;

public class NovelMetadataException extends RuntimeException {
    public NovelMetadataException(String message) {
        super(message);
    }
}
