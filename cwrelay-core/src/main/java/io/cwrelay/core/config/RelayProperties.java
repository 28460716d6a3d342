package io.cwrelay.core.config;

/**
 * Run settings for one relay run.
 *
 * Populated from HOCON by {@link RelayConfig#toProperties()} and then overridden by
 * command line flags.
 */
public class RelayProperties {

    /**
     * JSON file with the metric rules and the last run timestamp.
     */
    private String rulesFile = "etc/aws-metrics.json.conf";

    private String proxyHost = "127.0.0.1";

    private int proxyPort = 2878;

    /**
     * Print lines to standard output instead of sending them to the proxy.
     */
    private boolean dryRun = false;

    /**
     * Leave the statistic suffix off when a rule requests a single statistic.
     */
    private boolean suppressSingleStatSuffix = false;

    /**
     * Prepended to every output metric name.
     */
    private String metricPrefix = "";

    /**
     * Minutes of data to request when no watermark has been stored yet.
     */
    private int defaultDelayMinutes = 5;

    /**
     * "literal" or "in-range", see {@link io.cwrelay.core.DimensionIndexCheck}.
     */
    private String dimensionIndexCheck = "literal";

    /**
     * Threads fetching statistics in parallel. 1 keeps everything on the calling thread.
     */
    private int fetchThreads = 1;

    private int periodSeconds = 60;

    /**
     * Max retry attempts for upstream calls and proxy writes.
     */
    private int maxRetries = 3;

    /**
     * Initial retry delay in milliseconds (doubles each retry).
     */
    private int retryDelayMs = 1000;

    private int connectionTimeoutMs = 5000;

    /**
     * AWS region; empty uses the SDK default region chain.
     */
    private String awsRegion = "";

    // Getters and Setters

    public String getRulesFile() {
        return rulesFile;
    }

    public void setRulesFile(String rulesFile) {
        this.rulesFile = rulesFile;
    }

    public String getProxyHost() {
        return proxyHost;
    }

    public void setProxyHost(String proxyHost) {
        this.proxyHost = proxyHost;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public void setProxyPort(int proxyPort) {
        this.proxyPort = proxyPort;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isSuppressSingleStatSuffix() {
        return suppressSingleStatSuffix;
    }

    public void setSuppressSingleStatSuffix(boolean suppressSingleStatSuffix) {
        this.suppressSingleStatSuffix = suppressSingleStatSuffix;
    }

    public String getMetricPrefix() {
        return metricPrefix;
    }

    public void setMetricPrefix(String metricPrefix) {
        this.metricPrefix = metricPrefix;
    }

    public int getDefaultDelayMinutes() {
        return defaultDelayMinutes;
    }

    public void setDefaultDelayMinutes(int defaultDelayMinutes) {
        this.defaultDelayMinutes = defaultDelayMinutes;
    }

    public String getDimensionIndexCheck() {
        return dimensionIndexCheck;
    }

    public void setDimensionIndexCheck(String dimensionIndexCheck) {
        this.dimensionIndexCheck = dimensionIndexCheck;
    }

    public int getFetchThreads() {
        return fetchThreads;
    }

    public void setFetchThreads(int fetchThreads) {
        this.fetchThreads = fetchThreads;
    }

    public int getPeriodSeconds() {
        return periodSeconds;
    }

    public void setPeriodSeconds(int periodSeconds) {
        this.periodSeconds = periodSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(int retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public void setAwsRegion(String awsRegion) {
        this.awsRegion = awsRegion;
    }
}
