package com.delta.catalogcrawler.config;

import com.delta.catalogcrawler.crawl.render.RenderMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int concurrencyLimit = 5;
    private int requestTimeoutSeconds = 10;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private int renderTimeoutSeconds = 30;
    private int renderSettleMs = 2000;
    private int maxPagesPerSource = 50;
    private int interPageDelayMs = 500;
    private boolean enableLinkEnrichment = true;
    private int maxEnrichedRecordsPerSource = 20;
    private int interEnrichmentDelayMs = 500;
    private RenderMode defaultRenderMode = RenderMode.RENDERED;
    private RenderMode enrichmentRenderMode = RenderMode.RENDERED;
    private Parsing parsing = new Parsing();
    private Index index = new Index();
    private Keywords keywords = new Keywords();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getConcurrencyLimit() {
        return Math.max(1, concurrencyLimit);
    }

    public void setConcurrencyLimit(int concurrencyLimit) {
        this.concurrencyLimit = Math.max(1, concurrencyLimit);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    /**
     * Rendering waits for scripts and network idle, so it never gets less time than a raw request.
     */
    public int getRenderTimeoutSeconds() {
        return Math.max(getRequestTimeoutSeconds() + 1, renderTimeoutSeconds);
    }

    public void setRenderTimeoutSeconds(int renderTimeoutSeconds) {
        this.renderTimeoutSeconds = renderTimeoutSeconds;
    }

    public int getRenderSettleMs() {
        return Math.max(0, renderSettleMs);
    }

    public void setRenderSettleMs(int renderSettleMs) {
        this.renderSettleMs = renderSettleMs;
    }

    public int getMaxPagesPerSource() {
        return Math.max(1, maxPagesPerSource);
    }

    public void setMaxPagesPerSource(int maxPagesPerSource) {
        this.maxPagesPerSource = Math.max(1, maxPagesPerSource);
    }

    public int getInterPageDelayMs() {
        return Math.max(0, interPageDelayMs);
    }

    public void setInterPageDelayMs(int interPageDelayMs) {
        this.interPageDelayMs = Math.max(0, interPageDelayMs);
    }

    public boolean isEnableLinkEnrichment() {
        return enableLinkEnrichment;
    }

    public void setEnableLinkEnrichment(boolean enableLinkEnrichment) {
        this.enableLinkEnrichment = enableLinkEnrichment;
    }

    public int getMaxEnrichedRecordsPerSource() {
        return Math.max(0, maxEnrichedRecordsPerSource);
    }

    public void setMaxEnrichedRecordsPerSource(int maxEnrichedRecordsPerSource) {
        this.maxEnrichedRecordsPerSource = Math.max(0, maxEnrichedRecordsPerSource);
    }

    public int getInterEnrichmentDelayMs() {
        return Math.max(0, interEnrichmentDelayMs);
    }

    public void setInterEnrichmentDelayMs(int interEnrichmentDelayMs) {
        this.interEnrichmentDelayMs = Math.max(0, interEnrichmentDelayMs);
    }

    public RenderMode getDefaultRenderMode() {
        return defaultRenderMode == null ? RenderMode.RAW : defaultRenderMode;
    }

    public void setDefaultRenderMode(RenderMode defaultRenderMode) {
        this.defaultRenderMode = defaultRenderMode;
    }

    public RenderMode getEnrichmentRenderMode() {
        return enrichmentRenderMode == null ? getDefaultRenderMode() : enrichmentRenderMode;
    }

    public void setEnrichmentRenderMode(RenderMode enrichmentRenderMode) {
        this.enrichmentRenderMode = enrichmentRenderMode;
    }

    public Parsing getParsing() {
        return parsing;
    }

    public void setParsing(Parsing parsing) {
        this.parsing = parsing;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Keywords getKeywords() {
        return keywords;
    }

    public void setKeywords(Keywords keywords) {
        this.keywords = keywords;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Parsing {
        private String detailPathPattern = "/albums/\\d+";
        private int maxTitleLength = 200;

        public String getDetailPathPattern() {
            return detailPathPattern == null || detailPathPattern.isBlank() ? "/albums/\\d+" : detailPathPattern;
        }

        public void setDetailPathPattern(String detailPathPattern) {
            this.detailPathPattern = detailPathPattern;
        }

        public int getMaxTitleLength() {
            return Math.max(1, maxTitleLength);
        }

        public void setMaxTitleLength(int maxTitleLength) {
            this.maxTitleLength = maxTitleLength;
        }
    }

    public static class Index {
        private String typesenseUrl = "";
        private String apiKey = "";
        private String collection = "products";
        private int batchSize = 500;

        public String getTypesenseUrl() {
            return typesenseUrl;
        }

        public void setTypesenseUrl(String typesenseUrl) {
            this.typesenseUrl = typesenseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public boolean isEnabled() {
            return typesenseUrl != null && !typesenseUrl.isBlank();
        }
    }

    public static class Keywords {
        private long refreshMs = 300_000L;

        public long getRefreshMs() {
            return Math.max(1000L, refreshMs);
        }

        public void setRefreshMs(long refreshMs) {
            this.refreshMs = refreshMs;
        }
    }

    public static class Data {
        private String sourcesCsv = "../data/sources.csv";

        public String getSourcesCsv() {
            return sourcesCsv;
        }

        public void setSourcesCsv(String sourcesCsv) {
            this.sourcesCsv = sourcesCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private String sources = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
