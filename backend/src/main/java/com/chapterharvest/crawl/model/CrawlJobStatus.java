package com.chapterharvest.crawl.model;

public record CrawlJobStatus(String activeJobId, boolean cancelRequested, boolean stopRequested) {
    public boolean active() {
        return activeJobId != null;
    }
}
