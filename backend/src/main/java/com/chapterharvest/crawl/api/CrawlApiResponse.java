package com.chapterharvest.crawl.api;

import com.chapterharvest.crawl.model.ChapterList;

import java.util.List;

public record CrawlApiResponse(
    String jobId,
    List<String> titles,
    List<String> texts,
    List<Integer> indices,
    int count
) {
    static CrawlApiResponse of(String jobId, ChapterList chapters) {
        return new CrawlApiResponse(jobId, chapters.titles(), chapters.texts(), chapters.indices(), chapters.size());
    }
}
