package com.chapterharvest.crawl.service;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.extract.NovelMetadataExtractor;
import com.chapterharvest.crawl.http.ResilientFetchClient;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.FetchOptions;
import com.chapterharvest.crawl.model.HttpFetchResult;
import com.chapterharvest.crawl.model.NovelMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class NovelMetadataService {
    private static final Logger log = LoggerFactory.getLogger(NovelMetadataService.class);

    private final CrawlerProperties properties;
    private final ResilientFetchClient fetchClient;
    private final NovelMetadataExtractor extractor;

    public NovelMetadataService(
        CrawlerProperties properties,
        ResilientFetchClient fetchClient,
        NovelMetadataExtractor extractor
    ) {
        this.properties = properties;
        this.fetchClient = fetchClient;
        this.extractor = extractor;
    }

    public NovelMetadata fetchMetadata(String novelUrl, CancellationToken token) {
        if (novelUrl == null || novelUrl.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        FetchOptions options = FetchOptions.of(
            properties.getRequestMaxRetries(),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds())
        );
        HttpFetchResult result = fetchClient.fetch(novelUrl.trim(), options, token);
        NovelMetadata metadata = extractor.extract(result.body(), result.finalUrlOrRequested());
        log.info("Novel '{}' by {} starts at {}", metadata.title(), metadata.author(), metadata.startingUrl());
        return metadata;
    }
}
