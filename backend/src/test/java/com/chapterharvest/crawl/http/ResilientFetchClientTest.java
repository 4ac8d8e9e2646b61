package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.job.CrawlCancelledException;
import com.chapterharvest.crawl.model.FetchOptions;
import com.chapterharvest.crawl.model.HttpFetchResult;
import com.chapterharvest.crawl.proxy.ProxyPool;
import com.chapterharvest.crawl.proxy.ProxySourceLoader;
import com.chapterharvest.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientFetchClientTest {
    private static final String URL = "https://example.test/novel/demo/chapter-1";
    private static final String P1 = "http://10.0.0.1:8080";
    private static final String P2 = "http://10.0.0.2:8080";

    private final List<String> routes = Collections.synchronizedList(new ArrayList<>());
    private final List<String> userAgents = Collections.synchronizedList(new ArrayList<>());

    private ResilientFetchClient client(CrawlerProperties properties, ProxyPool pool, Function<String, HttpFetchResult> responder) {
        PageTransport transport = (url, proxyUrl, headers, timeout) -> {
            routes.add(proxyUrl);
            userAgents.add(headers.get("User-Agent"));
            return responder.apply(proxyUrl);
        };
        return new ResilientFetchClient(
            properties,
            transport,
            pool,
            new BlockDetector(properties),
            new BrowserIdentity(properties)
        );
    }

    private static ProxyPool pool(CrawlerProperties properties) {
        return new ProxyPool(properties, new ProxySourceLoader(properties), Clock.systemUTC());
    }

    private static HttpFetchResult ok(String proxy) {
        return new HttpFetchResult(URL, null, 200, "<p>chapter</p>", "text/html", proxy, Instant.now(), Duration.ZERO, null, null);
    }

    private static HttpFetchResult status(String proxy, int status) {
        return new HttpFetchResult(URL, null, status, "", "text/html", proxy, Instant.now(), Duration.ZERO, null, null);
    }

    private static HttpFetchResult ioError(String proxy) {
        return new HttpFetchResult(URL, null, 0, null, null, proxy, Instant.now(), Duration.ZERO, "io_error", "Connection reset");
    }

    private static HttpFetchResult interrupted(String proxy) {
        return new HttpFetchResult(URL, null, 0, null, null, proxy, Instant.now(), Duration.ZERO, "interrupted", null);
    }

    @Test
    void directFirstThenRotatesToProxies() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        ProxyPool pool = pool(properties);
        ResilientFetchClient client = client(properties, pool, proxy -> proxy == null ? ioError(null) : ok(proxy));

        HttpFetchResult result = client.fetch(URL, FetchOptions.of(4, Duration.ofSeconds(5)), CancellationToken.NONE);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(routes).hasSize(2);
        assertThat(routes.get(0)).isNull();
        assertThat(routes.get(1)).isIn(P1, P2);
    }

    @Test
    void preferredProxyIsTriedFirst() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        ResilientFetchClient client = client(properties, pool(properties), ResilientFetchClientTest::ok);

        client.fetch(URL, FetchOptions.of(3, Duration.ofSeconds(5)).withPreferredProxy(P2), CancellationToken.NONE);

        assertThat(routes).containsExactly(P2);
    }

    @Test
    void blockedAttemptRetriesWithAnotherIdentityOnSameRoute() {
        CrawlerProperties properties = TestProperties.withProxies();
        AtomicBoolean first = new AtomicBoolean(true);
        ResilientFetchClient client = client(
            properties,
            pool(properties),
            proxy -> first.getAndSet(false) ? status(proxy, 403) : ok(proxy)
        );

        HttpFetchResult result = client.fetch(URL, FetchOptions.of(3, Duration.ofSeconds(5)), CancellationToken.NONE);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(routes).containsExactly(null, null);
        assertThat(userAgents.get(0)).isNotEqualTo(userAgents.get(1));
    }

    @Test
    void blockedProxyIsDisqualified() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        ProxyPool pool = pool(properties);
        ResilientFetchClient client = client(properties, pool, proxy -> P1.equals(proxy) ? status(proxy, 403) : ok(proxy));

        HttpFetchResult result = client.fetch(
            URL,
            FetchOptions.of(3, Duration.ofSeconds(5)).withPreferredProxy(P1),
            CancellationToken.NONE
        );

        assertThat(result.isSuccessful()).isTrue();
        assertThat(routes).containsExactly(P1, P1, null);
        assertThat(pool.eligibleProxies()).containsExactly(P2);
    }

    @Test
    void exhaustedRetriesSurfaceLastError() {
        CrawlerProperties properties = TestProperties.withProxies(P1);
        ResilientFetchClient client = client(properties, pool(properties), ResilientFetchClientTest::ioError);

        assertThatThrownBy(() -> client.fetch(URL, FetchOptions.of(3, Duration.ofSeconds(5)), CancellationToken.NONE))
            .isInstanceOf(TransientFetchException.class)
            .hasMessageContaining("io_error");
        assertThat(routes).hasSize(3);
    }

    @Test
    void nonSuccessStatusIsTransient() {
        CrawlerProperties properties = TestProperties.withProxies();
        ResilientFetchClient client = client(properties, pool(properties), proxy -> status(proxy, 503));

        assertThatThrownBy(() -> client.fetch(URL, FetchOptions.of(2, Duration.ofSeconds(5)), CancellationToken.NONE))
            .isInstanceOfSatisfying(TransientFetchException.class, e -> assertThat(e.getStatusCode()).isEqualTo(503));
    }

    @Test
    void shortCircuitStopsAfterFirstBlockedAttempt() {
        CrawlerProperties properties = TestProperties.withProxies();
        properties.getBlock().setShortCircuit(true);
        ResilientFetchClient client = client(properties, pool(properties), proxy -> status(proxy, 429));

        assertThatThrownBy(() -> client.fetch(URL, FetchOptions.of(5, Duration.ofSeconds(5)), CancellationToken.NONE))
            .isInstanceOf(BlockedException.class);
        assertThat(routes).hasSize(2);
    }

    @Test
    void cancellationPreventsFurtherAttempts() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        CancellationToken token = new CancellationToken() {
            @Override
            public boolean isCancelled() {
                return cancelled.get();
            }

            @Override
            public boolean isStopped() {
                return false;
            }
        };
        ResilientFetchClient client = client(properties, pool(properties), proxy -> {
            cancelled.set(true);
            return ioError(proxy);
        });

        assertThatThrownBy(() -> client.fetch(URL, FetchOptions.of(5, Duration.ofSeconds(5)), token))
            .isInstanceOf(CrawlCancelledException.class);
        assertThat(routes).hasSize(1);
    }

    @Test
    void headersCarryBrowserIdentity() {
        CrawlerProperties properties = TestProperties.withProxies();
        properties.setUserAgent("pinned-agent/1.0");
        Map<String, String> headers = new BrowserIdentity(properties).headers("pinned-agent/1.0");

        assertThat(headers).containsEntry("User-Agent", "pinned-agent/1.0")
            .containsEntry("Referer", "https://freewebnovel.com/")
            .doesNotContainKey("Connection");
        assertThat(new BrowserIdentity(properties).alternateUserAgent("pinned-agent/1.0")).isNull();
    }

    @Test
    void interruptedAttemptStopsWithoutPenalisingProxy() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        properties.getProxy().setFailureThreshold(1);
        ProxyPool pool = pool(properties);
        ResilientFetchClient client = client(properties, pool, ResilientFetchClientTest::interrupted);

        assertThatThrownBy(() -> client.fetch(
            URL,
            FetchOptions.of(4, Duration.ofSeconds(5)).withPreferredProxy(P1),
            CancellationToken.NONE
        ))
            .isInstanceOfSatisfying(TransientFetchException.class, e -> assertThat(e.getErrorCode()).isEqualTo("interrupted"));
        assertThat(routes).containsExactly(P1);
        assertThat(pool.eligibleProxies()).containsExactlyInAnyOrder(P1, P2);
        assertThat(pool.records()).allSatisfy(record -> assertThat(record.failureScore()).isZero());
    }

    @Test
    void interruptFlagOnWorkerThreadStopsRetrying() {
        CrawlerProperties properties = TestProperties.withProxies(P1, P2);
        properties.getProxy().setFailureThreshold(1);
        ProxyPool pool = pool(properties);
        ResilientFetchClient client = client(properties, pool, proxy -> {
            Thread.currentThread().interrupt();
            return ioError(proxy);
        });

        try {
            assertThatThrownBy(() -> client.fetch(
                URL,
                FetchOptions.of(4, Duration.ofSeconds(5)).withPreferredProxy(P2),
                CancellationToken.NONE
            )).isInstanceOf(TransientFetchException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(routes).containsExactly(P2);
        assertThat(pool.eligibleProxies()).containsExactlyInAnyOrder(P1, P2);
    }

    @Test
    void interruptedAttemptDuringCancelRaisesCancellation() {
        CrawlerProperties properties = TestProperties.withProxies(P1);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        CancellationToken token = new CancellationToken() {
            @Override
            public boolean isCancelled() {
                return cancelled.get();
            }

            @Override
            public boolean isStopped() {
                return false;
            }
        };
        ProxyPool pool = pool(properties);
        ResilientFetchClient client = client(properties, pool, proxy -> {
            cancelled.set(true);
            return interrupted(proxy);
        });

        assertThatThrownBy(() -> client.fetch(URL, FetchOptions.of(3, Duration.ofSeconds(5)).withPreferredProxy(P1), token))
            .isInstanceOf(CrawlCancelledException.class);
        assertThat(pool.eligibleProxies()).containsExactly(P1);
    }
}
