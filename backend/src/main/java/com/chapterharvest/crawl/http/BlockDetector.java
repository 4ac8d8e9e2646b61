package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.BlockVerdict;
import com.chapterharvest.crawl.model.HttpFetchResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Classifies responses as anti-bot pages. Block status codes always count as blocked; phrase signals in the
 * leading part of the body can be overridden by metadata markers or by adaptive acceptance of large pages
 * that carry expected content keywords.
 */
@Component
public class BlockDetector {
    private final CrawlerProperties properties;

    public BlockDetector(CrawlerProperties properties) {
        this.properties = properties;
    }

    public BlockVerdict classify(HttpFetchResult result) {
        CrawlerProperties.Block config = properties.getBlock();
        if (!config.isEnabled()) {
            return BlockVerdict.clear("detection_disabled");
        }
        if (config.isLenient()) {
            return BlockVerdict.clear("lenient");
        }
        if (config.getStatusCodes().contains(result.statusCode())) {
            return BlockVerdict.blocked("status_" + result.statusCode());
        }
        if (!result.isSuccessful() || result.body() == null || result.body().isEmpty()) {
            return BlockVerdict.clear("no_content");
        }
        String body = result.body();
        String lowered = body.toLowerCase(Locale.ROOT);
        String head = lowered.substring(0, Math.min(lowered.length(), config.getScanChars()));
        int hits = 0;
        for (String phrase : config.getPhrases()) {
            if (phrase != null && !phrase.isBlank() && head.contains(phrase.toLowerCase(Locale.ROOT))) {
                hits++;
            }
        }
        if (hits < config.getMinSignalHits()) {
            return BlockVerdict.clear("no_signals");
        }
        if (containsAny(lowered, config.getMetadataMarkers().toArray(String[]::new))) {
            return BlockVerdict.clear("metadata_override");
        }
        if (body.getBytes(StandardCharsets.UTF_8).length >= config.getMinAcceptBytes()
            && containsAny(lowered, config.getExpectedKeywords().toArray(String[]::new))) {
            return BlockVerdict.clear("adaptive_accept");
        }
        return BlockVerdict.blocked("signals=" + hits);
    }

    private boolean containsAny(String lowered, String... needles) {
        for (String needle : needles) {
            if (needle != null && !needle.isBlank() && lowered.contains(needle.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
