package com.chapterharvest.crawl.extract;

import com.chapterharvest.crawl.model.ChapterPage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class JsoupChapterExtractorTest {
    private static final String PAGE_URL = "https://novels.test/novel/demo/chapter-7";

    private final JsoupChapterExtractor extractor = new JsoupChapterExtractor();

    @Test
    void extractsTitleTextAndNextLinkFromReaderLayout() {
        String html =
            """
                <html><body>
                  <a title="Read Next chapter" href="/novel/demo/chapter-8">Next</a>
                  <div class="m-read">
                    <span class="chapter">Chapter 7: The Gate</span>
                    <div id="article">
                      <p>First paragraph.</p>
                      <p>   </p>
                      <p>Second paragraph.</p>
                    </div>
                  </div>
                </body></html>
                """;

        ChapterPage page = extractor.extract(html, PAGE_URL);

        assertEquals("https://novels.test/novel/demo/chapter-8", page.nextUrl());
        assertEquals("Chapter 7: The Gate", page.title());
        assertEquals("First paragraph.\n\nSecond paragraph.", page.text());
    }

    @Test
    void fallsBackToRelNextAndHeadingTitle() {
        String html =
            """
                <html><head><link rel="next" href="/ignored"></head><body>
                  <a rel="nofollow next" href="chapter-8">continue</a>
                  <div class="chapter-content"><h2>Seven</h2><p>Body text</p></div>
                </body></html>
                """;

        ChapterPage page = extractor.extract(html, PAGE_URL);

        assertEquals("https://novels.test/novel/demo/chapter-8", page.nextUrl());
        assertEquals("Seven", page.title());
    }

    @Test
    void findsNextLinkByChapterNumberInHref() {
        String html = "<a href=\"/novel/demo/chapter-6\">prev</a><a href=\"/novel/demo/chapter-8\">&raquo;</a>"
            + "<div class=\"txt\"><p>Some long opening paragraph for the chapter body.</p></div>";

        ChapterPage page = extractor.extract(html, PAGE_URL);

        assertEquals("https://novels.test/novel/demo/chapter-8", page.nextUrl());
        assertThat(page.title()).endsWith("...");
    }

    @Test
    void emptyContainerYieldsEmptyTextAndNoNextLink() {
        String html = "<a rel=\"next\" href=\"/novel/demo/chapter-8\">next</a><div class=\"m-read\"><div id=\"article\"></div></div>";

        ChapterPage page = extractor.extract(html, PAGE_URL);

        assertFalse(page.hasText());
        assertNull(page.nextUrl());
    }

    @Test
    void missingContainerKeepsNextLink() {
        ChapterPage page = extractor.extract("<a rel=\"next\" href=\"/novel/demo/chapter-8\">next</a>", PAGE_URL);

        assertFalse(page.hasText());
        assertEquals("No content found", page.title());
        assertEquals("https://novels.test/novel/demo/chapter-8", page.nextUrl());
    }
}
