package com.chapterharvest.crawl.api;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.job.CrawlJobController;
import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.CrawlJobStatus;
import com.chapterharvest.crawl.model.CrawlOptions;
import com.chapterharvest.crawl.model.NovelMetadata;
import com.chapterharvest.crawl.model.ProxyPoolSnapshot;
import com.chapterharvest.crawl.model.ProxyRecord;
import com.chapterharvest.crawl.proxy.ProxyPool;
import com.chapterharvest.crawl.service.ChapterCrawlService;
import com.chapterharvest.crawl.service.NovelMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private static final Logger log = LoggerFactory.getLogger(CrawlController.class);

    private final ChapterCrawlService crawlService;
    private final NovelMetadataService metadataService;
    private final CrawlJobController jobController;
    private final ProxyPool proxyPool;
    private final CrawlerProperties crawlerProperties;

    public CrawlController(
        ChapterCrawlService crawlService,
        NovelMetadataService metadataService,
        CrawlJobController jobController,
        ProxyPool proxyPool,
        CrawlerProperties crawlerProperties
    ) {
        this.crawlService = crawlService;
        this.metadataService = metadataService;
        this.jobController = jobController;
        this.proxyPool = proxyPool;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping("/crawl")
    public CrawlApiResponse crawl(@RequestBody(required = false) CrawlApiRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "url is required");
        }
        int workers = request.workers() == null
            ? crawlerProperties.getChapters().getDefaultWorkers()
            : request.workers();
        CrawlOptions options = new CrawlOptions(
            workers,
            request.chapterLimit(),
            request.startChapter() == null ? 1 : request.startChapter()
        );
        String jobId = request.jobId() == null || request.jobId().isBlank()
            ? UUID.randomUUID().toString()
            : request.jobId().trim();

        jobController.start(jobId);
        try {
            String startUrl = request.url().trim();
            if (Boolean.TRUE.equals(request.resolveFirstChapter()) && !options.concurrent()) {
                NovelMetadata metadata = metadataService.fetchMetadata(startUrl, jobController);
                startUrl = metadata.startingUrl();
            }
            ChapterList chapters = crawlService.getChapters(startUrl, options, jobController);
            if (chapters.isEmpty() && !jobController.isStopped()) {
                throw new NoChaptersException("No chapters could be retrieved from " + startUrl);
            }
            log.info("Crawl job {} returned {} chapter(s)", jobId, chapters.size());
            return CrawlApiResponse.of(jobId, chapters);
        } finally {
            jobController.end(jobId);
        }
    }

    @PostMapping("/crawl/cancel")
    public CrawlJobStatus cancel() {
        jobController.requestCancel();
        return jobController.status();
    }

    @PostMapping("/crawl/stop")
    public CrawlJobStatus stop() {
        jobController.requestStop();
        return jobController.status();
    }

    @GetMapping("/crawl/status")
    public CrawlJobStatus status() {
        return jobController.status();
    }

    @GetMapping("/novels/metadata")
    public NovelMetadata metadata(@RequestParam(name = "url") String url) {
        if (url == null || url.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "url is required");
        }
        return metadataService.fetchMetadata(url, jobController);
    }

    @GetMapping("/proxies")
    public ProxyPoolSnapshot proxies() {
        return proxyPool.snapshot();
    }

    @GetMapping("/proxies/records")
    public List<ProxyRecord> proxyRecords() {
        return proxyPool.records();
    }
}
