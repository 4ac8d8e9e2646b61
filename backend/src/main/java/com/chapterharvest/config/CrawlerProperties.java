package com.chapterharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_REFERER = "https://freewebnovel.com/";
    private static final String DEFAULT_SITE_ORIGIN = "https://freewebnovel.com";

    private String userAgent;
    private String referer = DEFAULT_REFERER;
    private String siteOrigin = DEFAULT_SITE_ORIGIN;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 5;
    private int retryBaseDelayMs = 600;
    private int retryMaxDelayMs = 4000;
    private Proxy proxy = new Proxy();
    private Block block = new Block();
    private Chapters chapters = new Chapters();
    private Cli cli = new Cli();

    /**
     * Operator override for the User-Agent header; {@code null} means rotate through the built-in pool.
     */
    public String getUserAgent() {
        return normalizeOptional(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeOptional(userAgent);
    }

    public String getReferer() {
        String normalized = normalizeOptional(referer);
        return normalized == null ? DEFAULT_REFERER : normalized;
    }

    public void setReferer(String referer) {
        this.referer = referer;
    }

    public String getSiteOrigin() {
        String normalized = normalizeOptional(siteOrigin);
        return normalized == null ? DEFAULT_SITE_ORIGIN : normalized;
    }

    public void setSiteOrigin(String siteOrigin) {
        this.siteOrigin = siteOrigin;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(1, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(1, requestMaxRetries);
    }

    public int getRetryBaseDelayMs() {
        return Math.max(0, retryBaseDelayMs);
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public int getRetryMaxDelayMs() {
        return Math.max(0, retryMaxDelayMs);
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }

    public Chapters getChapters() {
        return chapters;
    }

    public void setChapters(Chapters chapters) {
        this.chapters = chapters;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    static String normalizeOptional(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        return candidate.trim();
    }

    public static class Proxy {
        private String primary;
        private boolean disablePublic;
        private List<String> urls = new ArrayList<>();
        private String yamlPath = "proxies.yaml";
        private String csvPath = "proxy_list.csv";
        private int cacheTtlSeconds = 300;
        private int quarantineSeconds = 600;
        private int failureThreshold = 3;
        private boolean neverReuseBlocked = true;

        public String getPrimary() {
            return normalizeOptional(primary);
        }

        public void setPrimary(String primary) {
            this.primary = normalizeOptional(primary);
        }

        public boolean isDisablePublic() {
            return disablePublic;
        }

        public void setDisablePublic(boolean disablePublic) {
            this.disablePublic = disablePublic;
        }

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls == null ? new ArrayList<>() : urls;
        }

        public String getYamlPath() {
            return normalizeOptional(yamlPath);
        }

        public void setYamlPath(String yamlPath) {
            this.yamlPath = yamlPath;
        }

        public String getCsvPath() {
            return normalizeOptional(csvPath);
        }

        public void setCsvPath(String csvPath) {
            this.csvPath = csvPath;
        }

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }

        public int getQuarantineSeconds() {
            return Math.max(1, quarantineSeconds);
        }

        public void setQuarantineSeconds(int quarantineSeconds) {
            this.quarantineSeconds = Math.max(1, quarantineSeconds);
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public boolean isNeverReuseBlocked() {
            return neverReuseBlocked;
        }

        public void setNeverReuseBlocked(boolean neverReuseBlocked) {
            this.neverReuseBlocked = neverReuseBlocked;
        }
    }

    /**
     * Anti-bot page heuristics. Thresholds are empirical and meant to be tuned per deployment.
     */
    public static class Block {
        private boolean enabled = true;
        private boolean lenient;
        private boolean shortCircuit;
        private List<Integer> statusCodes = new ArrayList<>(List.of(401, 403, 429));
        private List<String> phrases = new ArrayList<>(List.of(
            "captcha",
            "access denied",
            "forbidden",
            "cloudflare",
            "ddos protection",
            "verify you are human",
            "just a moment"
        ));
        private int scanChars = 8000;
        private int minSignalHits = 1;
        private int minAcceptBytes = 20000;
        private List<String> expectedKeywords = new ArrayList<>(List.of(
            "chapter",
            "m-read",
            "txt-article",
            "read-content"
        ));
        private List<String> metadataMarkers = new ArrayList<>(List.of(
            "og:novel:",
            "id=\"article\"",
            "class=\"chapter-content\""
        ));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLenient() {
            return lenient;
        }

        public void setLenient(boolean lenient) {
            this.lenient = lenient;
        }

        public boolean isShortCircuit() {
            return shortCircuit;
        }

        public void setShortCircuit(boolean shortCircuit) {
            this.shortCircuit = shortCircuit;
        }

        public List<Integer> getStatusCodes() {
            return statusCodes;
        }

        public void setStatusCodes(List<Integer> statusCodes) {
            this.statusCodes = statusCodes == null ? new ArrayList<>() : statusCodes;
        }

        public List<String> getPhrases() {
            return phrases;
        }

        public void setPhrases(List<String> phrases) {
            this.phrases = phrases == null ? new ArrayList<>() : phrases;
        }

        public int getScanChars() {
            return Math.max(1, scanChars);
        }

        public void setScanChars(int scanChars) {
            this.scanChars = Math.max(1, scanChars);
        }

        public int getMinSignalHits() {
            return Math.max(1, minSignalHits);
        }

        public void setMinSignalHits(int minSignalHits) {
            this.minSignalHits = Math.max(1, minSignalHits);
        }

        public int getMinAcceptBytes() {
            return Math.max(0, minAcceptBytes);
        }

        public void setMinAcceptBytes(int minAcceptBytes) {
            this.minAcceptBytes = Math.max(0, minAcceptBytes);
        }

        public List<String> getExpectedKeywords() {
            return expectedKeywords;
        }

        public void setExpectedKeywords(List<String> expectedKeywords) {
            this.expectedKeywords = expectedKeywords == null ? new ArrayList<>() : expectedKeywords;
        }

        public List<String> getMetadataMarkers() {
            return metadataMarkers;
        }

        public void setMetadataMarkers(List<String> metadataMarkers) {
            this.metadataMarkers = metadataMarkers == null ? new ArrayList<>() : metadataMarkers;
        }
    }

    public static class Chapters {
        private int indexRetries = 4;
        private int chapterRetries = 5;
        private int maxConsecutiveEmpty = 3;
        private int sequentialRetryPasses = 5;
        private int concurrentRetryPasses = 10;
        private int defaultWorkers = 0;
        private int maxWorkers = 16;

        public int getIndexRetries() {
            return Math.max(1, indexRetries);
        }

        public void setIndexRetries(int indexRetries) {
            this.indexRetries = Math.max(1, indexRetries);
        }

        public int getChapterRetries() {
            return Math.max(1, chapterRetries);
        }

        public void setChapterRetries(int chapterRetries) {
            this.chapterRetries = Math.max(1, chapterRetries);
        }

        public int getMaxConsecutiveEmpty() {
            return Math.max(1, maxConsecutiveEmpty);
        }

        public void setMaxConsecutiveEmpty(int maxConsecutiveEmpty) {
            this.maxConsecutiveEmpty = Math.max(1, maxConsecutiveEmpty);
        }

        public int getSequentialRetryPasses() {
            return Math.max(0, sequentialRetryPasses);
        }

        public void setSequentialRetryPasses(int sequentialRetryPasses) {
            this.sequentialRetryPasses = Math.max(0, sequentialRetryPasses);
        }

        public int getConcurrentRetryPasses() {
            return Math.max(0, concurrentRetryPasses);
        }

        public void setConcurrentRetryPasses(int concurrentRetryPasses) {
            this.concurrentRetryPasses = Math.max(0, concurrentRetryPasses);
        }

        public int getDefaultWorkers() {
            return Math.max(0, defaultWorkers);
        }

        public void setDefaultWorkers(int defaultWorkers) {
            this.defaultWorkers = Math.max(0, defaultWorkers);
        }

        public int getMaxWorkers() {
            return Math.max(1, maxWorkers);
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(1, maxWorkers);
        }
    }

    public static class Cli {
        private boolean run;
        private String url = "";
        private int workers;
        private int limit;
        private int start = 1;
        private String output = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = start;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
