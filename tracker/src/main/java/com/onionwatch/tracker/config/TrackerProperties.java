package com.onionwatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (urlfetch/1.0)";
    private static final String DEFAULT_FILTER_USER_AGENT = "Mozilla/5.0 (filter/2.2)";

    private Http http = new Http();
    private Verifier verifier = new Verifier();
    private Filter filter = new Filter();
    private WatchlistFile watchlist = new WatchlistFile();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Verifier getVerifier() {
        return verifier;
    }

    public void setVerifier(Verifier verifier) {
        this.verifier = verifier;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    public WatchlistFile getWatchlist() {
        return watchlist;
    }

    public void setWatchlist(WatchlistFile watchlist) {
        this.watchlist = watchlist;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate, String fallback) {
        if (candidate == null || candidate.isBlank()) {
            return fallback;
        }
        return candidate.trim();
    }

    static int requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException("tracker." + name + " must be >= 1 but was " + value);
        }
        return value;
    }

    static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("tracker." + name + " must be >= 0 but was " + value);
        }
        return value;
    }

    public static class Http {
        private String userAgent = DEFAULT_USER_AGENT;
        private int requestTimeoutSeconds = 30;
        private int connectTimeoutSeconds = 30;
        private Proxy proxy = new Proxy();

        public String getUserAgent() {
            return normalizeUserAgent(userAgent, DEFAULT_USER_AGENT);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requirePositive("http.request-timeout-seconds", requestTimeoutSeconds);
        }

        public int getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = requirePositive("http.connect-timeout-seconds", connectTimeoutSeconds);
        }

        public Proxy getProxy() {
            return proxy;
        }

        public void setProxy(Proxy proxy) {
            this.proxy = proxy;
        }
    }

    /**
     * SOCKS5 proxy the tracker routes every request through. Host names are resolved by the proxy,
     * which is what makes {@code .onion} addresses reachable through a local Tor daemon.
     */
    public static class Proxy {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 9050;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = requirePositive("http.proxy.port", port);
        }
    }

    public static class Verifier {
        private int workerCount = 100;
        private int batchSize = 100;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = requirePositive("verifier.worker-count", workerCount);
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = requirePositive("verifier.batch-size", batchSize);
        }
    }

    public static class Filter {
        private String userAgent = DEFAULT_FILTER_USER_AGENT;
        private int requestTimeoutSeconds = 60;
        private int maxAttempts = 3;
        private int retryDelayMs = 3000;
        private int retryIncrementMs = 2000;
        private int snippetBefore = 80;
        private int snippetAfter = 120;
        private boolean pruneStale = false;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent, DEFAULT_FILTER_USER_AGENT);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requirePositive("filter.request-timeout-seconds", requestTimeoutSeconds);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = requirePositive("filter.max-attempts", maxAttempts);
        }

        public int getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = requireNonNegative("filter.retry-delay-ms", retryDelayMs);
        }

        public int getRetryIncrementMs() {
            return retryIncrementMs;
        }

        public void setRetryIncrementMs(int retryIncrementMs) {
            this.retryIncrementMs = requireNonNegative("filter.retry-increment-ms", retryIncrementMs);
        }

        public int getSnippetBefore() {
            return snippetBefore;
        }

        public void setSnippetBefore(int snippetBefore) {
            this.snippetBefore = requireNonNegative("filter.snippet-before", snippetBefore);
        }

        public int getSnippetAfter() {
            return snippetAfter;
        }

        public void setSnippetAfter(int snippetAfter) {
            this.snippetAfter = requireNonNegative("filter.snippet-after", snippetAfter);
        }

        public boolean isPruneStale() {
            return pruneStale;
        }

        public void setPruneStale(boolean pruneStale) {
            this.pruneStale = pruneStale;
        }
    }

    public static class WatchlistFile {
        private String path = "config.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private String command = "none";
        private Integer cleanOldDays;
        private boolean exitAfterRun = true;

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public Integer getCleanOldDays() {
            return cleanOldDays;
        }

        public void setCleanOldDays(Integer cleanOldDays) {
            if (cleanOldDays != null) {
                requireNonNegative("cli.clean-old-days", cleanOldDays);
            }
            this.cleanOldDays = cleanOldDays;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
