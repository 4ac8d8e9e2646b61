package com.chapterharvest.crawl.model;

import java.time.Instant;
import java.util.Locale;

/**
 * Health state of a single relay endpoint. Records are replaced, never mutated in place.
 */
public record ProxyRecord(
    String url,
    int failureScore,
    Instant quarantinedUntil,
    boolean dead
) {
    public static ProxyRecord fresh(String url) {
        return new ProxyRecord(url, 0, null, false);
    }

    public boolean isEligible(Instant now) {
        if (dead) {
            return false;
        }
        return quarantinedUntil == null || !quarantinedUntil.isAfter(now);
    }

    public boolean isSocks() {
        return url != null && url.toLowerCase(Locale.ROOT).startsWith("socks");
    }

    public ProxyRecord withFailureScore(int score) {
        return new ProxyRecord(url, score, quarantinedUntil, dead);
    }

    public ProxyRecord quarantined(Instant until) {
        return new ProxyRecord(url, 0, until, dead);
    }

    public ProxyRecord markedDead() {
        return new ProxyRecord(url, failureScore, quarantinedUntil, true);
    }
}
