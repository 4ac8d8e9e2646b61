package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.BlockVerdict;
import com.chapterharvest.crawl.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BlockDetectorTest {
    private final CrawlerProperties properties = new CrawlerProperties();
    private final BlockDetector detector = new BlockDetector(properties);

    private static HttpFetchResult response(int status, String body) {
        return new HttpFetchResult(
            "https://example.test/novel/demo/chapter-1",
            null,
            status,
            body,
            "text/html",
            null,
            Instant.now(),
            Duration.ZERO,
            null,
            null
        );
    }

    @Test
    void blockStatusIsBlockedWhateverTheBody() {
        String richPage = "<meta property=\"og:novel:author\" content=\"A\"><div id=\"article\"><p>chapter</p></div>";

        assertThat(detector.classify(response(403, richPage)).blocked()).isTrue();
        assertThat(detector.classify(response(429, "")).blocked()).isTrue();
        assertThat(detector.classify(response(401, "ok")).reason()).isEqualTo("status_401");
    }

    @Test
    void challengePageIsBlocked() {
        BlockVerdict verdict = detector.classify(response(200, "<title>Just a moment...</title> Checking your browser"));

        assertThat(verdict.blocked()).isTrue();
        assertThat(verdict.reason()).isEqualTo("signals=1");
    }

    @Test
    void metadataMarkersOverridePhraseSignals() {
        String body = "<html><head><meta property=\"og:novel:novel_name\" content=\"Demo\"></head>"
            + "<body>Protected by Cloudflare<div class=\"m-read\"><p>Text</p></div></body></html>";

        BlockVerdict verdict = detector.classify(response(200, body));

        assertThat(verdict.blocked()).isFalse();
        assertThat(verdict.reason()).isEqualTo("metadata_override");
    }

    @Test
    void largePagesWithExpectedContentAreAccepted() {
        String body = "<div class=\"txt\">Access denied was what the guard said.</div>"
            + "<p>chapter text </p>".repeat(2000);

        BlockVerdict verdict = detector.classify(response(200, body));

        assertThat(verdict.blocked()).isFalse();
        assertThat(verdict.reason()).isEqualTo("adaptive_accept");
    }

    @Test
    void ordinaryPagesAndErrorsAreNotBlocked() {
        assertThat(detector.classify(response(200, "<p>Once upon a time</p>")).blocked()).isFalse();
        assertThat(detector.classify(response(500, "captcha")).blocked()).isFalse();
    }

    @Test
    void lenientModeAcceptsEverything() {
        properties.getBlock().setLenient(true);

        assertThat(detector.classify(response(403, "captcha")).blocked()).isFalse();
    }
}
