package com.chapterharvest.crawl.model;

public record ChapterResult(int index, String title, String text) {
    public ChapterResult {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("chapter " + index + " has no text");
        }
        if (title == null || title.isBlank()) {
            title = "Chapter " + index;
        }
    }
}
