package com.chapterharvest.crawl.model;

public record BlockVerdict(boolean blocked, String reason) {
    public static BlockVerdict blocked(String reason) {
        return new BlockVerdict(true, reason);
    }

    public static BlockVerdict clear(String reason) {
        return new BlockVerdict(false, reason);
    }
}
