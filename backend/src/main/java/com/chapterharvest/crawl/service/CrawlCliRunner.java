package com.chapterharvest.crawl.service;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.job.CrawlJobController;
import com.chapterharvest.crawl.model.ChapterList;
import com.chapterharvest.crawl.model.CrawlOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final ChapterCrawlService crawlService;
    private final CrawlJobController jobController;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        ChapterCrawlService crawlService,
        CrawlJobController jobController,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlService = crawlService;
        this.jobController = jobController;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        CrawlerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        if (cli.getUrl() == null || cli.getUrl().isBlank()) {
            log.warn("crawler.cli.run is set but crawler.cli.url is empty; nothing to crawl");
            return;
        }

        String jobId = "cli-" + UUID.randomUUID();
        CrawlOptions options = new CrawlOptions(cli.getWorkers(), cli.getLimit(), cli.getStart());
        ChapterList chapters;
        jobController.start(jobId);
        try {
            chapters = crawlService.getChapters(cli.getUrl(), options, jobController);
        } finally {
            jobController.end(jobId);
        }
        log.info("CLI crawl of {} collected {} chapter(s), indices={}", cli.getUrl(), chapters.size(), chapters.indices());

        if (cli.getOutput() != null && !cli.getOutput().isBlank()) {
            Path output = Path.of(cli.getOutput());
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("titles", chapters.titles());
            document.put("texts", chapters.texts());
            document.put("indices", chapters.indices());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), document);
            log.info("Wrote chapters to {}", output.toAbsolutePath());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
