package com.chapterharvest.crawl.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered crawl output: three parallel lists of equal length with strictly increasing indices.
 */
public record ChapterList(List<String> titles, List<String> texts, List<Integer> indices) {
    public ChapterList {
        titles = List.copyOf(titles);
        texts = List.copyOf(texts);
        indices = List.copyOf(indices);
        if (titles.size() != texts.size() || texts.size() != indices.size()) {
            throw new IllegalArgumentException("titles, texts and indices must have equal length");
        }
        for (int i = 1; i < indices.size(); i++) {
            if (indices.get(i) <= indices.get(i - 1)) {
                throw new IllegalArgumentException("indices must be strictly increasing");
            }
        }
    }

    public static ChapterList empty() {
        return new ChapterList(List.of(), List.of(), List.of());
    }

    public static ChapterList of(Collection<ChapterResult> results) {
        List<ChapterResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingInt(ChapterResult::index));
        List<String> titles = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Integer> indices = new ArrayList<>();
        for (ChapterResult result : sorted) {
            if (!indices.isEmpty() && indices.get(indices.size() - 1) == result.index()) {
                continue;
            }
            titles.add(result.title());
            texts.add(result.text());
            indices.add(result.index());
        }
        return new ChapterList(titles, texts, indices);
    }

    public ChapterList limitedTo(Integer limit) {
        if (limit == null || limit <= 0 || limit >= size()) {
            return this;
        }
        return new ChapterList(titles.subList(0, limit), texts.subList(0, limit), indices.subList(0, limit));
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }
}
