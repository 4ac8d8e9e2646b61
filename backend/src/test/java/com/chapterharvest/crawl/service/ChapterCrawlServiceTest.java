package com.chapterharvest.crawl.service;

import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.ChapterResult;
import com.chapterharvest.crawl.model.ConcurrentCrawlOutcome;
import com.chapterharvest.crawl.model.CrawlOptions;
import com.chapterharvest.crawl.proxy.ProxyPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChapterCrawlServiceTest {
    private static final String URL = "https://novels.test/novel/demo";

    @Mock
    private SequentialChapterCrawler sequentialCrawler;

    @Mock
    private ConcurrentChapterCrawler concurrentCrawler;

    @Mock
    private ProxyPool proxyPool;

    @InjectMocks
    private ChapterCrawlService service;

    private static ChapterList chapters(int... indices) {
        List<ChapterResult> results = new ArrayList<>();
        for (int index : indices) {
            results.add(new ChapterResult(index, "Chapter " + index, "text " + index));
        }
        return ChapterList.of(results);
    }

    @Test
    void zeroWorkersUsesLinkFollowing() {
        when(sequentialCrawler.crawl(eq(URL), any(), any())).thenReturn(chapters(1, 2));

        ChapterList result = service.getChapters(URL, CrawlOptions.sequential(), CancellationToken.NONE);

        assertThat(result.indices()).containsExactly(1, 2);
        verify(concurrentCrawler, never()).crawl(any(), any(), any());
    }

    @Test
    void emptyIndexCrawlFallsBackToLinkFollowing() {
        CrawlOptions options = new CrawlOptions(3, null, 1);
        when(concurrentCrawler.crawl(URL, options, CancellationToken.NONE)).thenReturn(ConcurrentCrawlOutcome.noResults());
        when(sequentialCrawler.crawl(URL, options, CancellationToken.NONE)).thenReturn(chapters(1));

        ChapterList result = service.getChapters(URL, options, CancellationToken.NONE);

        assertThat(result.indices()).containsExactly(1);
        verify(proxyPool).load(false);
    }

    @Test
    void concurrentResultsAreCappedToTheLimit() {
        CrawlOptions options = new CrawlOptions(3, 2, 1);
        when(concurrentCrawler.crawl(URL, options, CancellationToken.NONE))
            .thenReturn(ConcurrentCrawlOutcome.completed(chapters(1, 2, 3)));

        ChapterList result = service.getChapters(URL, options, CancellationToken.NONE);

        assertThat(result.indices()).containsExactly(1, 2);
        verify(sequentialCrawler, never()).crawl(any(), any(), any());
    }

    @Test
    void blankUrlIsRejected() {
        assertThatThrownBy(() -> service.getChapters(" ", CrawlOptions.sequential(), CancellationToken.NONE))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
