package com.chapterharvest.crawl.model;

/**
 * Unit of crawl work. {@code index} is the canonical ordering key of the chapter.
 */
public record ChapterTask(int index, String url) {
}
