package com.chapterharvest.crawl.service;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.extract.ChapterIndexParser;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.job.CrawlCancelledException;
import com.chapterharvest.crawl.model.ChapterPage;
import com.chapterharvest.crawl.model.ChapterResult;
import com.chapterharvest.crawl.model.ChapterTask;
import com.chapterharvest.crawl.model.ConcurrentCrawlOutcome;
import com.chapterharvest.crawl.model.CrawlOptions;
import com.chapterharvest.crawl.proxy.ProxyPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Index-based crawl: every chapter listed on the index page is dispatched to a pool of {@code W} worker
 * streams, each pinned to its own sticky proxy. Results are consumed in arrival order by the calling
 * thread, which alone owns the deferred queue and the result map.
 */
@Service
public class ConcurrentChapterCrawler {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentChapterCrawler.class);
    private static final long POLL_MILLIS = 200;

    private final CrawlerProperties properties;
    private final ChapterPageFetcher fetcher;
    private final ChapterIndexParser indexParser;
    private final ProxyPool proxyPool;
    private final DeferredChapterRetrier retrier;

    public ConcurrentChapterCrawler(
        CrawlerProperties properties,
        ChapterPageFetcher fetcher,
        ChapterIndexParser indexParser,
        ProxyPool proxyPool,
        DeferredChapterRetrier retrier
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.indexParser = indexParser;
        this.proxyPool = proxyPool;
        this.retrier = retrier;
    }

    public ConcurrentCrawlOutcome crawl(String indexUrl, CrawlOptions options, CancellationToken token) {
        token.checkCancelled();
        List<ChapterTask> tasks = loadTasks(indexUrl, options, token);
        if (tasks.isEmpty()) {
            log.warn("No chapters selected from index {}", indexUrl);
            return ConcurrentCrawlOutcome.noResults();
        }

        int width = Math.max(1, Math.min(options.workers(), properties.getChapters().getMaxWorkers()));
        List<String> sticky = proxyPool.sampleStickyPool(width);
        CrawlLedger ledger = new CrawlLedger();
        boolean stopped = false;

        ExecutorService executor = Executors.newFixedThreadPool(width, workerThreadFactory());
        try {
            CompletionService<ChapterAttempt> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < tasks.size(); i++) {
                ChapterTask task = tasks.get(i);
                int stream = i % width;
                String proxy = sticky.get(stream);
                Set<String> avoid = otherStreams(sticky, stream);
                completion.submit(() -> fetchTask(task, proxy, avoid, token));
            }
            log.info("Dispatched {} chapter(s) across {} worker stream(s)", tasks.size(), width);

            int pending = tasks.size();
            while (pending > 0) {
                token.checkCancelled();
                if (token.isStopped()) {
                    stopped = true;
                    log.info("Stop requested; abandoning {} in-flight chapter(s)", pending);
                    break;
                }
                Future<ChapterAttempt> future = poll(completion);
                if (future == null) {
                    continue;
                }
                pending--;
                ChapterAttempt attempt = await(future);
                if (!attempt.page().hasText()) {
                    ledger.defer(attempt.task());
                    continue;
                }
                ledger.record(new ChapterResult(attempt.task().index(), attempt.page().title(), attempt.page().text()));
                retrier.retryOldest(ledger, token);
            }
        } finally {
            executor.shutdownNow();
        }

        if (!stopped) {
            retrier.retryPasses(ledger, properties.getChapters().getConcurrentRetryPasses(), token);
        }
        if (ledger.collected() == 0 && !stopped) {
            return ConcurrentCrawlOutcome.noResults();
        }
        log.info("Concurrent crawl of {} collected {}/{} chapter(s)", indexUrl, ledger.collected(), tasks.size());
        return ConcurrentCrawlOutcome.completed(ledger.toChapterList());
    }

    List<ChapterTask> loadTasks(String indexUrl, CrawlOptions options, CancellationToken token) {
        String html = fetcher.fetchIndex(indexUrl, token);
        if (html == null) {
            return List.of();
        }
        List<ChapterTask> listed = indexParser.parse(html, indexUrl);
        List<ChapterTask> selected = new ArrayList<>();
        for (ChapterTask task : listed) {
            if (task.index() < options.startChapter()) {
                continue;
            }
            if (options.limitReached(selected.size())) {
                break;
            }
            selected.add(task);
        }
        log.info("Index {} lists {} chapter(s); {} selected", indexUrl, listed.size(), selected.size());
        return selected;
    }

    private static Set<String> otherStreams(List<String> sticky, int stream) {
        Set<String> avoid = new HashSet<>();
        for (int i = 0; i < sticky.size(); i++) {
            String proxy = sticky.get(i);
            if (i != stream && proxy != null && !proxy.equals(sticky.get(stream))) {
                avoid.add(proxy);
            }
        }
        return avoid;
    }

    private Future<ChapterAttempt> poll(CompletionService<ChapterAttempt> completion) {
        try {
            return completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlCancelledException("Interrupted while collecting chapters");
        }
    }

    private ChapterAttempt await(Future<ChapterAttempt> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlCancelledException("Interrupted while collecting chapters");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CrawlCancelledException cancelled) {
                throw cancelled;
            }
            throw new IllegalStateException("Chapter worker failed", cause);
        }
    }

    private ChapterAttempt fetchTask(ChapterTask task, String proxy, Set<String> avoid, CancellationToken token) {
        try {
            return new ChapterAttempt(task, fetcher.fetchChapter(task.url(), proxy, avoid, token));
        } catch (CrawlCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Chapter {} worker failed for {}", task.index(), task.url(), e);
            return new ChapterAttempt(task, ChapterPage.empty(null));
        }
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("chapter-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record ChapterAttempt(ChapterTask task, ChapterPage page) {
    }
}
