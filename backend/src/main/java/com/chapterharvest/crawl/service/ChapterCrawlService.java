package com.chapterharvest.crawl.service;

import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.ConcurrentCrawlOutcome;
import com.chapterharvest.crawl.model.CrawlOptions;
import com.chapterharvest.crawl.proxy.ProxyPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for chapter retrieval. Picks the index-based strategy when workers are requested and
 * falls back to link following from the same URL when it collects nothing.
 */
@Service
public class ChapterCrawlService {
    private static final Logger log = LoggerFactory.getLogger(ChapterCrawlService.class);

    private final SequentialChapterCrawler sequentialCrawler;
    private final ConcurrentChapterCrawler concurrentCrawler;
    private final ProxyPool proxyPool;

    public ChapterCrawlService(
        SequentialChapterCrawler sequentialCrawler,
        ConcurrentChapterCrawler concurrentCrawler,
        ProxyPool proxyPool
    ) {
        this.sequentialCrawler = sequentialCrawler;
        this.concurrentCrawler = concurrentCrawler;
        this.proxyPool = proxyPool;
    }

    public ChapterList getChapters(String startUrl, CrawlOptions options, CancellationToken token) {
        if (startUrl == null || startUrl.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        String url = startUrl.trim();
        CrawlOptions safeOptions = options == null ? CrawlOptions.sequential() : options;
        CancellationToken safeToken = token == null ? CancellationToken.NONE : token;
        proxyPool.load(false);

        ChapterList chapters;
        if (safeOptions.concurrent()) {
            ConcurrentCrawlOutcome outcome = concurrentCrawler.crawl(url, safeOptions, safeToken);
            if (outcome.hasResults()) {
                chapters = outcome.chapters();
            } else {
                log.info("Index-based crawl of {} collected nothing; falling back to link following", url);
                chapters = sequentialCrawler.crawl(url, safeOptions, safeToken);
            }
        } else {
            chapters = sequentialCrawler.crawl(url, safeOptions, safeToken);
        }
        ChapterList limited = chapters.limitedTo(safeOptions.chapterLimit());
        log.info("Crawl of {} finished with {} chapter(s)", url, limited.size());
        return limited;
    }
}
