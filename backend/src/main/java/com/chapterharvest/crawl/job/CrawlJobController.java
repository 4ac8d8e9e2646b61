package com.chapterharvest.crawl.job;

import com.chapterharvest.crawl.model.CrawlJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide coordinator for the single active crawl job and its cancel/stop requests.
 * One coarse lock guards all state since only one job is ever active.
 */
@Service
public class CrawlJobController implements CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobController.class);

    private final Object lock = new Object();
    private String activeJobId;
    private boolean cancelRequested;
    private boolean stopRequested;

    public void start(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        synchronized (lock) {
            if (activeJobId != null && !activeJobId.equals(jobId) && !cancelRequested) {
                throw new ActiveCrawlJobException("Another crawl job is already active (id=" + activeJobId + ")");
            }
            activeJobId = jobId;
            cancelRequested = false;
            stopRequested = false;
        }
        log.info("Crawl job {} started", jobId);
    }

    public void end(String jobId) {
        synchronized (lock) {
            if (activeJobId == null || !activeJobId.equals(jobId)) {
                return;
            }
            activeJobId = null;
            cancelRequested = false;
            stopRequested = false;
        }
        log.info("Crawl job {} ended", jobId);
    }

    public void requestCancel() {
        synchronized (lock) {
            cancelRequested = true;
        }
        log.info("Cancellation requested");
    }

    public void requestStop() {
        synchronized (lock) {
            stopRequested = true;
        }
        log.info("Stop requested");
    }

    public void raiseIfCancelled() {
        checkCancelled();
    }

    @Override
    public boolean isCancelled() {
        synchronized (lock) {
            return cancelRequested;
        }
    }

    @Override
    public boolean isStopped() {
        synchronized (lock) {
            return stopRequested;
        }
    }

    public CrawlJobStatus status() {
        synchronized (lock) {
            return new CrawlJobStatus(activeJobId, cancelRequested, stopRequested);
        }
    }
}
