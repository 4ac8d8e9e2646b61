package com.chapterharvest.crawl.service;

import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.ChapterPage;
import com.chapterharvest.crawl.model.ChapterResult;
import com.chapterharvest.crawl.model.ChapterTask;
import com.chapterharvest.crawl.proxy.ProxyPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Re-attempts deferred chapters on a freshly sampled route. Runs on the collecting thread only.
 */
@Component
class DeferredChapterRetrier {
    private static final Logger log = LoggerFactory.getLogger(DeferredChapterRetrier.class);

    private final ChapterPageFetcher fetcher;
    private final ProxyPool proxyPool;

    DeferredChapterRetrier(ChapterPageFetcher fetcher, ProxyPool proxyPool) {
        this.fetcher = fetcher;
        this.proxyPool = proxyPool;
    }

    /**
     * Pops the oldest deferred chapter and tries it once; a repeat failure goes to the back of the queue.
     */
    void retryOldest(CrawlLedger ledger, CancellationToken token) {
        ChapterTask task = ledger.pollDeferred();
        if (task == null) {
            return;
        }
        if (!retry(task, ledger, token)) {
            ledger.defer(task);
        }
    }

    void retryPasses(CrawlLedger ledger, int maxPasses, CancellationToken token) {
        for (int pass = 1; pass <= maxPasses && ledger.hasDeferred(); pass++) {
            token.checkCancelled();
            if (token.isStopped()) {
                log.info("Stop requested; skipping remaining retry passes");
                break;
            }
            List<ChapterTask> pending = ledger.drainDeferred();
            log.info("Retry pass {}/{} for {} deferred chapter(s)", pass, maxPasses, pending.size());
            for (ChapterTask task : pending) {
                token.checkCancelled();
                if (!retry(task, ledger, token)) {
                    ledger.defer(task);
                }
            }
        }
        if (ledger.hasDeferred()) {
            log.warn("Dropping chapter(s) {} after exhausting retries", ledger.deferredIndices());
        }
    }

    private boolean retry(ChapterTask task, CrawlLedger ledger, CancellationToken token) {
        if (ledger.has(task.index())) {
            return true;
        }
        String proxy = proxyPool.samplePrimary();
        ChapterPage page = fetcher.fetchChapter(task.url(), proxy, Set.of(), token);
        if (!page.hasText()) {
            log.debug("Deferred chapter {} still empty via proxy={}", task.index(), proxy == null ? "direct" : proxy);
            return false;
        }
        ledger.record(new ChapterResult(task.index(), page.title(), page.text()));
        log.info("Recovered chapter {} on retry", task.index());
        return true;
    }
}
