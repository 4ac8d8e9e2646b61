package com.chapterharvest.crawl.proxy;

import com.chapterharvest.config.CrawlerProperties;
import com.chapterharvest.crawl.model.ProxyPoolSnapshot;
import com.chapterharvest.crawl.model.ProxyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the candidate relay endpoints and their health. All state is guarded by one internal lock
 * because worker threads report outcomes concurrently.
 *
 * <p>A {@code null} proxy means a direct connection. The operator-pinned primary proxy is exempt from
 * health tracking.
 */
@Service
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);

    private final CrawlerProperties properties;
    private final ProxySourceLoader loader;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, ProxyRecord> records = new LinkedHashMap<>();
    private List<String> candidates = List.of();
    private Instant loadedAt;

    public ProxyPool(CrawlerProperties properties, ProxySourceLoader loader, Clock clock) {
        this.properties = properties;
        this.loader = loader;
        this.clock = clock;
    }

    /**
     * Re-reads the proxy sources once the cache TTL has passed. Files are read outside the pool lock.
     */
    public void load(boolean force) {
        synchronized (lock) {
            if (!force && isFreshLocked(clock.instant())) {
                return;
            }
        }
        List<String> loaded = loader.loadCandidates();
        synchronized (lock) {
            Instant now = clock.instant();
            if (!force && isFreshLocked(now)) {
                return;
            }
            List<String> merged = new ArrayList<>(new LinkedHashSet<>(trimAll(loaded)));
            Collections.shuffle(merged, ThreadLocalRandom.current());
            if (properties.getProxy().isDisablePublic()) {
                merged = List.of();
            }
            for (String url : merged) {
                records.putIfAbsent(url, ProxyRecord.fresh(url));
            }
            candidates = List.copyOf(merged);
            loadedAt = now;
            log.debug("Proxy pool loaded candidates={} eligible={}", candidates.size(), eligibleLocked(now).size());
        }
    }

    private boolean isFreshLocked(Instant now) {
        Duration ttl = Duration.ofSeconds(properties.getProxy().getCacheTtlSeconds());
        return loadedAt != null && now.isBefore(loadedAt.plus(ttl));
    }

    /**
     * The pinned primary if configured, otherwise a random eligible proxy, or {@code null} for direct.
     */
    public String samplePrimary() {
        load(false);
        String primary = properties.getProxy().getPrimary();
        if (primary != null) {
            return primary;
        }
        synchronized (lock) {
            List<String> eligible = eligibleLocked(clock.instant());
            if (eligible.isEmpty()) {
                return null;
            }
            return eligible.get(ThreadLocalRandom.current().nextInt(eligible.size()));
        }
    }

    /**
     * One proxy per worker stream; {@code null} entries are direct-connection streams.
     */
    public List<String> sampleStickyPool(int count) {
        load(false);
        if (count <= 0) {
            return new ArrayList<>();
        }
        List<String> out = new ArrayList<>(count);
        String primary = properties.getProxy().getPrimary();
        if (primary != null) {
            out.add(primary);
            while (out.size() < count) {
                out.add(null);
            }
            return out;
        }
        List<String> pool;
        synchronized (lock) {
            Instant now = clock.instant();
            List<String> socks = new ArrayList<>();
            List<String> plain = new ArrayList<>();
            for (String url : eligibleLocked(now)) {
                if (records.get(url).isSocks()) {
                    socks.add(url);
                } else {
                    plain.add(url);
                }
            }
            pool = socks.isEmpty() ? plain : socks;
        }
        List<String> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, ThreadLocalRandom.current());
        for (int i = 0; i < shuffled.size() && out.size() < count; i++) {
            out.add(shuffled.get(i));
        }
        while (out.size() < count) {
            out.add(null);
        }
        return out;
    }

    public List<String> eligibleProxies() {
        load(false);
        synchronized (lock) {
            return eligibleLocked(clock.instant());
        }
    }

    /**
     * False only for proxies that are currently quarantined or disqualified.
     */
    public boolean isUsable(String proxy) {
        if (proxy == null || isPrimary(proxy)) {
            return true;
        }
        synchronized (lock) {
            ProxyRecord record = records.get(proxy);
            return record == null || record.isEligible(clock.instant());
        }
    }

    public boolean isPrimary(String proxy) {
        return proxy != null && proxy.equals(properties.getProxy().getPrimary());
    }

    public void reportSuccess(String proxy) {
        if (proxy == null || isPrimary(proxy)) {
            return;
        }
        synchronized (lock) {
            ProxyRecord record = records.get(proxy);
            if (record != null && record.failureScore() != 0) {
                records.put(proxy, record.withFailureScore(0));
            }
        }
    }

    public void reportFailure(String proxy, boolean permanent) {
        if (proxy == null || isPrimary(proxy)) {
            return;
        }
        synchronized (lock) {
            ProxyRecord record = records.getOrDefault(proxy, ProxyRecord.fresh(proxy));
            if (record.dead()) {
                return;
            }
            if (permanent) {
                records.put(proxy, record.markedDead());
                log.warn("Proxy {} disqualified for the rest of the process", proxy);
                return;
            }
            int score = record.failureScore() + 1;
            if (score >= properties.getProxy().getFailureThreshold()) {
                Instant until = clock.instant().plusSeconds(properties.getProxy().getQuarantineSeconds());
                records.put(proxy, record.quarantined(until));
                log.warn("Quarantined proxy {} fail_score={} until={}", proxy, score, until);
            } else {
                records.put(proxy, record.withFailureScore(score));
            }
        }
    }

    public ProxyPoolSnapshot snapshot() {
        load(false);
        synchronized (lock) {
            Instant now = clock.instant();
            int quarantined = 0;
            int dead = 0;
            for (ProxyRecord record : records.values()) {
                if (record.dead()) {
                    dead++;
                } else if (!record.isEligible(now)) {
                    quarantined++;
                }
            }
            return new ProxyPoolSnapshot(
                properties.getProxy().getPrimary(),
                eligibleLocked(now),
                records.size(),
                quarantined,
                dead,
                loadedAt
            );
        }
    }

    public List<ProxyRecord> records() {
        synchronized (lock) {
            return List.copyOf(records.values());
        }
    }

    private List<String> eligibleLocked(Instant now) {
        List<String> eligible = new ArrayList<>();
        for (String url : candidates) {
            ProxyRecord record = records.get(url);
            if (record != null && record.isEligible(now)) {
                eligible.add(url);
            }
        }
        return eligible;
    }

    private static List<String> trimAll(List<String> raw) {
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }
}
