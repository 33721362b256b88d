package com.bidradar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bidradar")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "bid-radar/0.1 (opportunity crawler; +contact)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 8000;
    private int sourceConcurrency = 1;
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
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
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getSourceConcurrency() {
        return Math.max(1, sourceConcurrency);
    }

    public void setSourceConcurrency(int sourceConcurrency) {
        this.sourceConcurrency = Math.max(1, sourceConcurrency);
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

    public static class Data {
        private String sourcesFile = "config/sources.yml";
        private String historyFile = "data/processed/opportunities.ndjson";

        public String getSourcesFile() {
            return sourcesFile;
        }

        public void setSourcesFile(String sourcesFile) {
            this.sourcesFile = sourcesFile;
        }

        public String getHistoryFile() {
            return historyFile;
        }

        public void setHistoryFile(String historyFile) {
            this.historyFile = historyFile;
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "ingest";
        private String testSource = "";
        private int limit = 10;
        private boolean fetchDetails = true;
        private String out = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getTestSource() {
            return testSource;
        }

        public void setTestSource(String testSource) {
            this.testSource = testSource;
        }

        public int getLimit() {
            return Math.max(1, limit);
        }

        public void setLimit(int limit) {
            this.limit = Math.max(1, limit);
        }

        public boolean isFetchDetails() {
            return fetchDetails;
        }

        public void setFetchDetails(boolean fetchDetails) {
            this.fetchDetails = fetchDetails;
        }

        public String getOut() {
            return out;
        }

        public void setOut(String out) {
            this.out = out;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
