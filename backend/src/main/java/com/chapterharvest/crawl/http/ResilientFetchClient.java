package com.chapterharvest.crawl.http;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.job.CancellationToken;
import com.chapterharvest.crawl.model.BlockVerdict;
import com.chapterharvest.crawl.model.FetchOptions;
import com.chapterharvest.crawl.model.HttpFetchResult;
import com.chapterharvest.crawl.proxy.ProxyPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One logical GET: rotates routes across attempts, backs off exponentially with jitter, retries a blocked
 * attempt once with another browser identity, and feeds every outcome back into the {@link ProxyPool}.
 */
@Service
public class ResilientFetchClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientFetchClient.class);

    private final CrawlerProperties properties;
    private final PageTransport transport;
    private final ProxyPool proxyPool;
    private final BlockDetector blockDetector;
    private final BrowserIdentity identity;

    public ResilientFetchClient(
        CrawlerProperties properties,
        PageTransport transport,
        ProxyPool proxyPool,
        BlockDetector blockDetector,
        BrowserIdentity identity
    ) {
        this.properties = properties;
        this.transport = transport;
        this.proxyPool = proxyPool;
        this.blockDetector = blockDetector;
        this.identity = identity;
    }

    public HttpFetchResult fetch(String url, FetchOptions options, CancellationToken token) {
        CancellationToken safeToken = token == null ? CancellationToken.NONE : token;
        boolean directAllowed = options.allowDirect() && properties.getProxy().getPrimary() == null;
        Set<String> attempted = new HashSet<>();
        boolean directTried = false;
        FetchException lastError = null;
        int retries = options.retries();

        for (int attempt = 0; attempt < retries; attempt++) {
            safeToken.checkCancelled();
            String proxy = chooseRoute(attempt, options, attempted, directTried, directAllowed);
            if (proxy == null) {
                directTried = true;
            } else {
                attempted.add(proxy);
            }
            try {
                HttpFetchResult result = attemptOnce(url, proxy, options.timeout(), safeToken);
                proxyPool.reportSuccess(proxy);
                log.debug("GET {} status={} chars={} proxy={}", url, result.statusCode(), result.bodyLength(), routeName(proxy));
                if (attempt > 0) {
                    log.info("Fetched {} after {} attempt(s) using proxy={}", url, attempt + 1, routeName(proxy));
                }
                return result;
            } catch (BlockedException e) {
                lastError = e;
                log.warn("Blocked for {} proxy={} reason={}", url, routeName(proxy), e.getReason());
                proxyPool.reportFailure(proxy, properties.getProxy().isNeverReuseBlocked());
                if (properties.getBlock().isShortCircuit()) {
                    break;
                }
            } catch (TransientFetchException e) {
                lastError = e;
                if (isInterruption(e)) {
                    log.debug("Fetch of {} interrupted on proxy={}", url, routeName(proxy));
                    break;
                }
                log.warn(
                    "Attempt {}/{} failed for {} proxy={}: {}",
                    attempt + 1,
                    retries,
                    url,
                    routeName(proxy),
                    e.getMessage()
                );
                proxyPool.reportFailure(proxy, false);
            }
            if (attempt < retries - 1 && !sleepBackoff(attempt)) {
                break;
            }
        }
        safeToken.checkCancelled();
        if (lastError == null) {
            throw new TransientFetchException("No attempt made for " + url, url, null, 0, "no_attempt");
        }
        throw lastError;
    }

    /**
     * Route for this attempt; {@code null} is a direct connection.
     */
    String chooseRoute(
        int attempt,
        FetchOptions options,
        Set<String> attempted,
        boolean directTried,
        boolean directAllowed
    ) {
        if (attempt == 0 && options.preferredProxy() != null && proxyPool.isUsable(options.preferredProxy())) {
            return options.preferredProxy();
        }
        if (attempt == 0 && directAllowed) {
            return null;
        }
        if (attempt == 0 && properties.getProxy().getPrimary() != null) {
            return properties.getProxy().getPrimary();
        }
        if (attempt == 1 && directAllowed && !directTried) {
            return null;
        }
        List<String> eligible = proxyPool.eligibleProxies();
        List<String> available = new ArrayList<>();
        for (String proxy : eligible) {
            if (!attempted.contains(proxy) && !options.avoidProxies().contains(proxy)) {
                available.add(proxy);
            }
        }
        if (!available.isEmpty()) {
            return pick(available);
        }
        if (directAllowed && !directTried) {
            return null;
        }
        List<String> fallback = new ArrayList<>();
        for (String proxy : eligible) {
            if (!options.avoidProxies().contains(proxy)) {
                fallback.add(proxy);
            }
        }
        if (!fallback.isEmpty()) {
            return pick(fallback);
        }
        return properties.getProxy().getPrimary();
    }

    private HttpFetchResult attemptOnce(String url, String proxy, Duration timeout, CancellationToken token) {
        String userAgent = identity.userAgent();
        HttpFetchResult result = send(url, proxy, userAgent, timeout);
        BlockVerdict verdict = blockDetector.classify(result);
        if (verdict.blocked()) {
            String alternate = identity.alternateUserAgent(userAgent);
            if (alternate != null) {
                log.debug("Blocked for {} proxy={} ({}); retrying with alternate identity", url, routeName(proxy), verdict.reason());
                token.checkCancelled();
                result = send(url, proxy, alternate, timeout);
                verdict = blockDetector.classify(result);
            }
            if (verdict.blocked()) {
                throw new BlockedException(
                    "Blocked content detected (status=" + result.statusCode() + ", " + verdict.reason() + ")",
                    url,
                    proxy,
                    result.statusCode(),
                    verdict.reason()
                );
            }
        }
        if (!result.isSuccessful()) {
            throw new TransientFetchException(
                "HTTP " + result.statusCode() + " for " + url,
                url,
                proxy,
                result.statusCode(),
                "http_status"
            );
        }
        return result;
    }

    private HttpFetchResult send(String url, String proxy, String userAgent, Duration timeout) {
        HttpFetchResult result = transport.get(url, proxy, identity.headers(userAgent), timeout);
        if (result.isTransportError()) {
            throw new TransientFetchException(
                result.errorCode() + ": " + result.errorMessage(),
                url,
                proxy,
                0,
                result.errorCode()
            );
        }
        return result;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(20, attempt));
        int maxDelayMs = properties.getRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long sleepMs = Math.round(delay * ThreadLocalRandom.current().nextDouble(0.75, 1.25));
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Our own shutdown interrupting the worker, which says nothing about the proxy.
     */
    private static boolean isInterruption(TransientFetchException e) {
        return "interrupted".equals(e.getErrorCode()) || Thread.currentThread().isInterrupted();
    }

    private static String pick(List<String> proxies) {
        return proxies.get(ThreadLocalRandom.current().nextInt(proxies.size()));
    }

    private static String routeName(String proxy) {
        return proxy == null ? "direct" : proxy;
    }
}
