package com.chapterharvest.crawl.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChapterListTest {

    @Test
    void ordersByIndexAndDropsDuplicates() {
        ChapterList list = ChapterList.of(List.of(
            new ChapterResult(3, "Three", "c"),
            new ChapterResult(1, "One", "a"),
            new ChapterResult(3, "Three again", "c2"),
            new ChapterResult(2, " ", "b")
        ));

        assertThat(list.indices()).containsExactly(1, 2, 3);
        assertThat(list.titles()).containsExactly("One", "Chapter 2", "Three");
        assertThat(list.limitedTo(2).indices()).containsExactly(1, 2);
        assertThat(list.limitedTo(null).size()).isEqualTo(3);
    }

    @Test
    void rejectsMisalignedOrUnorderedLists() {
        assertThatThrownBy(() -> new ChapterList(List.of("a"), List.of(), List.of(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChapterList(List.of("a", "b"), List.of("x", "y"), List.of(2, 2)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void chapterResultsNeedText() {
        assertThatThrownBy(() -> new ChapterResult(1, "Title", "  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
