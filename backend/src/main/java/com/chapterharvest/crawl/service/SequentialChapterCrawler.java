package com.chapterharvest.crawl.service;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.extract.ChapterUrls;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.ChapterPage;
import com.chapterharvest.crawl.model.ChapterResult;
import com.chapterharvest.crawl.model.ChapterTask;
import com.chapterharvest.crawl.model.CrawlOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * Follows next links from a starting chapter page. Chapters are numbered by the order in which their
 * pages are visited, starting at 1.
 */
@Service
public class SequentialChapterCrawler {
    private static final Logger log = LoggerFactory.getLogger(SequentialChapterCrawler.class);

    private final CrawlerProperties properties;
    private final ChapterPageFetcher fetcher;
    private final DeferredChapterRetrier retrier;

    public SequentialChapterCrawler(
        CrawlerProperties properties,
        ChapterPageFetcher fetcher,
        DeferredChapterRetrier retrier
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.retrier = retrier;
    }

    public ChapterList crawl(String startUrl, CrawlOptions options, CancellationToken token) {
        CrawlLedger ledger = new CrawlLedger();
        int maxConsecutiveEmpty = properties.getChapters().getMaxConsecutiveEmpty();
        Set<String> visited = new HashSet<>();
        String url = startUrl;
        int ordinal = 0;
        int consecutiveEmpty = 0;
        boolean stopped = false;

        while (url != null) {
            token.checkCancelled();
            if (token.isStopped()) {
                stopped = true;
                log.info("Stop requested; returning {} chapter(s) collected so far", ledger.collected());
                break;
            }
            if (options.limitReached(ledger.collected())) {
                break;
            }
            if (!visited.add(url)) {
                log.warn("Next link loops back to {}; ending crawl", url);
                break;
            }
            ordinal++;
            boolean wanted = ordinal >= options.startChapter();
            ChapterPage page = fetcher.fetchChapter(url, null, Set.of(), token);

            if (!page.hasText()) {
                consecutiveEmpty++;
                log.warn("Chapter {} at {} came back empty ({} in a row)", ordinal, url, consecutiveEmpty);
                if (wanted) {
                    ledger.defer(new ChapterTask(ordinal, url));
                }
                if (consecutiveEmpty >= maxConsecutiveEmpty) {
                    log.warn("Aborting crawl after {} consecutive empty chapters", consecutiveEmpty);
                    break;
                }
            } else {
                consecutiveEmpty = 0;
                if (wanted) {
                    ledger.record(new ChapterResult(ordinal, page.title(), page.text()));
                    retrier.retryOldest(ledger, token);
                }
            }
            url = nextUrl(page, url);
        }

        if (!stopped) {
            retrier.retryPasses(ledger, properties.getChapters().getSequentialRetryPasses(), token);
        }
        ChapterList chapters = ledger.toChapterList();
        log.info("Sequential crawl from {} collected {} chapter(s)", startUrl, chapters.size());
        return chapters;
    }

    private String nextUrl(ChapterPage page, String currentUrl) {
        if (page.nextUrl() != null && !page.nextUrl().isBlank()) {
            return page.nextUrl();
        }
        String guessed = ChapterUrls.guessNextUrl(currentUrl);
        if (guessed != null) {
            log.debug("No next link on {}; guessing {}", currentUrl, guessed);
        }
        return guessed;
    }
}
