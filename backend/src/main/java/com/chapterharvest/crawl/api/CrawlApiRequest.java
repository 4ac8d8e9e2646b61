package com.chapterharvest.crawl.api;

public record CrawlApiRequest(
    String url,
    Integer workers,
    Integer chapterLimit,
    Integer startChapter,
    Boolean resolveFirstChapter,
    String jobId
) {
}
