package com.chapterharvest.crawl.model;

import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-call knobs for a resilient fetch. {@code preferredProxy == null} means no preference;
 * {@code avoidProxies} may contain {@code null} only in the sense that it is ignored.
 */
public record FetchOptions(
    int retries,
    Duration timeout,
    String preferredProxy,
    Set<String> avoidProxies,
    boolean allowDirect
) {
    public FetchOptions {
        retries = Math.max(1, retries);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofSeconds(15);
        }
        Set<String> avoid = new HashSet<>();
        if (avoidProxies != null) {
            for (String proxy : avoidProxies) {
                if (proxy != null && !proxy.isBlank()) {
                    avoid.add(proxy);
                }
            }
        }
        avoidProxies = Collections.unmodifiableSet(avoid);
    }

    public static FetchOptions of(int retries, Duration timeout) {
        return new FetchOptions(retries, timeout, null, Set.of(), true);
    }

    public FetchOptions withPreferredProxy(String proxy) {
        return new FetchOptions(retries, timeout, proxy, avoidProxies, allowDirect);
    }

    public FetchOptions withAvoidProxies(Set<String> proxies) {
        return new FetchOptions(retries, timeout, preferredProxy, proxies, allowDirect);
    }
}
