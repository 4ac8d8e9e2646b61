package com.chapterharvest.crawl.extract;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.ChapterTask;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChapterIndexParserTest {
    private final ChapterIndexParser parser = new ChapterIndexParser(new CrawlerProperties());

    @Test
    void collectsChapterLinksInNumericOrder() {
        String html =
            """
                <ul id="idData">
                  <li><a href="/novel/demo/chapter-10">Chapter 10</a></li>
                  <li><a href="/novel/demo/chapter-2">Chapter 2</a></li>
                  <li><a href="https://novels.test/novel/demo/chapter-1">Chapter 1</a></li>
                  <li><a href="/novel/demo/chapter-2">Chapter 2 (again)</a></li>
                  <li><a href="/genre/fantasy">Fantasy</a></li>
                  <li><a href="/novel/demo">Index</a></li>
                </ul>
                """;

        List<ChapterTask> tasks = parser.parse(html, "https://novels.test/novel/demo");

        assertThat(tasks).extracting(ChapterTask::index).containsExactly(1, 2, 10);
        assertThat(tasks).extracting(ChapterTask::url).containsExactly(
            "https://novels.test/novel/demo/chapter-1",
            "https://novels.test/novel/demo/chapter-2",
            "https://novels.test/novel/demo/chapter-10"
        );
    }

    @Test
    void relativeLinksFallBackToSiteOrigin() {
        List<ChapterTask> tasks = parser.parse("<a href=\"/novel/demo/chapter-3\">3</a>", null);

        assertThat(tasks).extracting(ChapterTask::url).containsExactly("https://freewebnovel.com/novel/demo/chapter-3");
    }

    @Test
    void differentUrlsForTheSameChapterCollapseToOneTask() {
        String html =
            """
                <a href="https://novels.test/novel/demo/chapter-1">Chapter 1</a>
                <a href="http://novels.test/novel/demo/chapter-1">Chapter 1 (http)</a>
                <a href="/novel/demo/chapter-2?from=toc">Chapter 2</a>
                <a href="/novel/demo/chapter-2">Chapter 2 (plain)</a>
                <a href="/novel/demo/chapter-3">Chapter 3</a>
                """;

        List<ChapterTask> tasks = parser.parse(html, "https://novels.test/novel/demo");

        assertThat(tasks).extracting(ChapterTask::index).containsExactly(1, 2, 3);
        assertThat(tasks).extracting(ChapterTask::url).containsExactly(
            "https://novels.test/novel/demo/chapter-1",
            "https://novels.test/novel/demo/chapter-2?from=toc",
            "https://novels.test/novel/demo/chapter-3"
        );
    }

    @Test
    void emptyOrLinklessPagesYieldNoTasks() {
        assertThat(parser.parse("", "https://novels.test/novel/demo")).isEmpty();
        assertThat(parser.parse("<p>nothing here</p>", "https://novels.test/novel/demo")).isEmpty();
    }
}
