package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@Component
public class BrowserIdentity {
    static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 13_4) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/16.0 Safari/605.1.15",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:124.0) Gecko/20100101 Firefox/124.0"
    );

    private final CrawlerProperties properties;

    public BrowserIdentity(CrawlerProperties properties) {
        this.properties = properties;
    }

    public String userAgent() {
        String override = properties.getUserAgent();
        if (override != null) {
            return override;
        }
        return USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size()));
    }

    /**
     * A user agent different from {@code current}, or {@code null} when the operator pinned one.
     */
    public String alternateUserAgent(String current) {
        if (properties.getUserAgent() != null) {
            return null;
        }
        List<String> others = new ArrayList<>(USER_AGENTS);
        others.remove(current);
        if (others.isEmpty()) {
            return null;
        }
        return others.get(ThreadLocalRandom.current().nextInt(others.size()));
    }

    public Map<String, String> headers(String userAgent) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Cache-Control", "no-cache");
        headers.put("Pragma", "no-cache");
        headers.put("Referer", properties.getReferer());
        return headers;
    }
}
