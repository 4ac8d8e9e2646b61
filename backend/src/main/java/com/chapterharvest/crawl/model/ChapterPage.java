package com.chapterharvest.crawl.model;

/**
 * What a chapter extractor found on one fetched page. Empty text marks a failed chapter.
 */
public record ChapterPage(String nextUrl, String title, String text) {
    public static ChapterPage empty(String title) {
        return new ChapterPage(null, title, "");
    }

    public static ChapterPage empty(String nextUrl, String title) {
        return new ChapterPage(nextUrl, title, "");
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
