package com.chapterharvest.crawl.model;

public record CrawlOptions(int workers, Integer chapterLimit, int startChapter) {
    public CrawlOptions {
        workers = Math.max(0, workers);
        if (chapterLimit != null && chapterLimit <= 0) {
            chapterLimit = null;
        }
        startChapter = Math.max(1, startChapter);
    }

    public static CrawlOptions sequential() {
        return new CrawlOptions(0, null, 1);
    }

    public boolean concurrent() {
        return workers > 0;
    }

    public boolean limitReached(int collected) {
        return chapterLimit != null && collected >= chapterLimit;
    }
}
