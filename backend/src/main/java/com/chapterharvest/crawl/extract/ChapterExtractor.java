package com.chapterharvest.crawl.extract;

import com.chapterharvest.crawl.model.ChapterPage;

/**
 * Site-specific heuristics that turn a fetched chapter page into (next link, title, text).
 * A page without usable content yields empty text, never an exception.
 */
public interface ChapterExtractor {
    ChapterPage extract(String html, String pageUrl);
}
