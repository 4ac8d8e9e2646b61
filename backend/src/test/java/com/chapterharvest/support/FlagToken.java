package com.chapterharvest.support;

import com.chapterharvest.crawl.job.CancellationToken;

import java.util.concurrent.atomic.AtomicBoolean;

public final class FlagToken implements CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public void stop() {
        stopped.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }
}
