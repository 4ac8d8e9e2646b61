package com.chapterharvest.crawl.model;

import java.time.Instant;
import java.util.List;

public record ProxyPoolSnapshot(
    String primaryProxy,
    List<String> eligible,
    int knownCount,
    int quarantinedCount,
    int deadCount,
    Instant loadedAt
) {
}
