package com.chapterharvest.crawl.model;

/**
 * Result of an index-based crawl. {@link Status#NO_RESULTS} tells the caller to fall back to link following.
 */
public record ConcurrentCrawlOutcome(Status status, ChapterList chapters) {
    public enum Status {
        COMPLETED,
        NO_RESULTS
    }

    public static ConcurrentCrawlOutcome completed(ChapterList chapters) {
        return new ConcurrentCrawlOutcome(Status.COMPLETED, chapters);
    }

    public static ConcurrentCrawlOutcome noResults() {
        return new ConcurrentCrawlOutcome(Status.NO_RESULTS, ChapterList.empty());
    }

    public boolean hasResults() {
        return status == Status.COMPLETED;
    }
}
