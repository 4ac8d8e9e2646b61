package com.chapterharvest.crawl.service;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.extract.ChapterExtractor;
import com.chapterharvest.crawl.http.FetchException;
import com.chapterharvest.crawl.http.ResilientFetchClient;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.ChapterPage;
import com.chapterharvest.crawl.model.FetchOptions;
import com.chapterharvest.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Set;

/**
 * Fetch-then-extract for a single page. Exhausted fetches degrade to an empty page so the crawl can
 * defer the chapter; cancellation still propagates.
 */
@Service
public class ChapterPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(ChapterPageFetcher.class);

    private final CrawlerProperties properties;
    private final ResilientFetchClient fetchClient;
    private final ChapterExtractor extractor;

    public ChapterPageFetcher(CrawlerProperties properties, ResilientFetchClient fetchClient, ChapterExtractor extractor) {
        this.properties = properties;
        this.fetchClient = fetchClient;
        this.extractor = extractor;
    }

    public ChapterPage fetchChapter(String url, String preferredProxy, Set<String> avoidProxies, CancellationToken token) {
        FetchOptions options = FetchOptions.of(properties.getChapters().getChapterRetries(), timeout())
            .withPreferredProxy(preferredProxy)
            .withAvoidProxies(avoidProxies);
        HttpFetchResult result;
        try {
            result = fetchClient.fetch(url, options, token);
        } catch (FetchException e) {
            log.warn("Giving up on chapter page {}: {}", url, e.getMessage());
            return ChapterPage.empty(null);
        }
        return extractor.extract(result.body(), result.finalUrlOrRequested());
    }

    /**
     * Raw index HTML, or {@code null} when every attempt failed.
     */
    public String fetchIndex(String indexUrl, CancellationToken token) {
        FetchOptions options = FetchOptions.of(properties.getChapters().getIndexRetries(), timeout());
        try {
            return fetchClient.fetch(indexUrl, options, token).body();
        } catch (FetchException e) {
            log.warn("Failed to fetch chapter index {}: {}", indexUrl, e.getMessage());
            return null;
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }
}
