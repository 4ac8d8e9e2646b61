package com.chapterharvest.crawl.service;

import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.ChapterResult;
import com.chapterharvest.crawl.model.ChapterTask;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Results keyed by chapter index plus the FIFO of deferred chapters. Owned by the single collecting
 * thread of a crawl; not thread-safe.
 */
final class CrawlLedger {
    private final Map<Integer, ChapterResult> results = new TreeMap<>();
    private final Deque<ChapterTask> deferred = new ArrayDeque<>();

    void record(ChapterResult result) {
        results.put(result.index(), result);
    }

    boolean has(int index) {
        return results.containsKey(index);
    }

    int collected() {
        return results.size();
    }

    void defer(ChapterTask task) {
        if (!has(task.index())) {
            deferred.addLast(task);
        }
    }

    ChapterTask pollDeferred() {
        return deferred.pollFirst();
    }

    boolean hasDeferred() {
        return !deferred.isEmpty();
    }

    List<ChapterTask> drainDeferred() {
        List<ChapterTask> out = new ArrayList<>(deferred);
        deferred.clear();
        return out;
    }

    List<Integer> deferredIndices() {
        List<Integer> out = new ArrayList<>();
        for (ChapterTask task : deferred) {
            out.add(task.index());
        }
        return out;
    }

    ChapterList toChapterList() {
        return ChapterList.of(results.values());
    }
}
