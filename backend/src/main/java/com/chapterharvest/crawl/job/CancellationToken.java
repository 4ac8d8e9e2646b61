package com.chapterharvest.crawl.job;

/**
 * Cooperative cancellation signal threaded through fetches and crawl loops.
 * Cancel is a hard abort (raises at the next checkpoint); stop is a graceful drain (checked, never raised).
 */
public interface CancellationToken {
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public boolean isStopped() {
            return false;
        }
    };

    boolean isCancelled();

    boolean isStopped();

    default void checkCancelled() {
        if (isCancelled()) {
            throw new CrawlCancelledException("Operation cancelled by user");
        }
    }
}
