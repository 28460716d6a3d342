package io.cwrelay.core.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads relay settings from HOCON files.
 *
 * Configuration is loaded in the following order (later sources override earlier):
 * 1. application.conf from classpath (defaults)
 * 2. File given with --settings (optional override)
 * 3. System properties (highest priority)
 *
 * Example HOCON configuration:
 * <pre>
 * relay {
 *     rules-file = "/opt/wavefront/etc/aws-metrics.json.conf"
 *     proxy-host = "127.0.0.1"
 *     proxy-port = 2878
 *     dry-run = false
 *     suppress-single-stat-suffix = false
 *     metric-prefix = ""
 *     default-delay-minutes = 5
 *     dimension-index-check = "literal"
 *     fetch-threads = 1
 *     period-seconds = 60
 *     connection-timeout-ms = 5000
 *
 *     retry {
 *         max-retries = 3
 *         initial-delay-ms = 1000
 *     }
 *
 *     aws {
 *         region = ""
 *     }
 * }
 * </pre>
 */
public class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);
    private static final String CONFIG_PREFIX = "relay";

    private final Config config;

    /**
     * Load configuration from default locations.
     */
    public RelayConfig() {
        this.config = ConfigFactory.load().resolve();
        log.debug("Configuration loaded from default locations");
    }

    /**
     * Load configuration with an optional external settings file.
     *
     * @param externalConfigPath path to external config file (can be null)
     */
    public RelayConfig(String externalConfigPath) {
        Config classpathConfig = ConfigFactory.load();
        Config resultConfig;

        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            File externalFile = new File(externalConfigPath);
            if (externalFile.exists()) {
                log.info("Loading external settings from: {}", externalConfigPath);
                Config externalConfig = ConfigFactory.parseFile(externalFile);
                Config withExternal = externalConfig.withFallback(classpathConfig);
                resultConfig = ConfigFactory.systemProperties().withFallback(withExternal);
            } else {
                log.warn("External settings file not found: {}", externalConfigPath);
                resultConfig = classpathConfig;
            }
        } else {
            resultConfig = classpathConfig;
        }

        this.config = resultConfig.resolve();
        log.debug("Configuration loaded successfully");
    }

    /**
     * Create RelayConfig from an existing Config object.
     */
    public RelayConfig(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    public String getRulesFile() {
        return getString("rules-file", "etc/aws-metrics.json.conf");
    }

    public String getProxyHost() {
        return getString("proxy-host", "127.0.0.1");
    }

    public int getProxyPort() {
        return getInt("proxy-port", 2878);
    }

    public boolean isDryRun() {
        return getBoolean("dry-run", false);
    }

    public boolean isSuppressSingleStatSuffix() {
        return getBoolean("suppress-single-stat-suffix", false);
    }

    public String getMetricPrefix() {
        return getString("metric-prefix", "");
    }

    public int getDefaultDelayMinutes() {
        return getInt("default-delay-minutes", 5);
    }

    public String getDimensionIndexCheck() {
        return getString("dimension-index-check", "literal");
    }

    public int getFetchThreads() {
        return getInt("fetch-threads", 1);
    }

    public int getPeriodSeconds() {
        return getInt("period-seconds", 60);
    }

    public int getConnectionTimeoutMs() {
        return getInt("connection-timeout-ms", 5000);
    }

    public int getMaxRetries() {
        return getInt("retry.max-retries", 3);
    }

    public int getRetryDelayMs() {
        return getInt("retry.initial-delay-ms", 1000);
    }

    public String getAwsRegion() {
        return getString("aws.region", "");
    }

    public RelayProperties toProperties() {
        RelayProperties props = new RelayProperties();
        props.setRulesFile(getRulesFile());
        props.setProxyHost(getProxyHost());
        props.setProxyPort(getProxyPort());
        props.setDryRun(isDryRun());
        props.setSuppressSingleStatSuffix(isSuppressSingleStatSuffix());
        props.setMetricPrefix(getMetricPrefix());
        props.setDefaultDelayMinutes(getDefaultDelayMinutes());
        props.setDimensionIndexCheck(getDimensionIndexCheck());
        props.setFetchThreads(getFetchThreads());
        props.setPeriodSeconds(getPeriodSeconds());
        props.setConnectionTimeoutMs(getConnectionTimeoutMs());
        props.setMaxRetries(getMaxRetries());
        props.setRetryDelayMs(getRetryDelayMs());
        props.setAwsRegion(getAwsRegion());
        return props;
    }

    // Helper methods for accessing config with defaults

    private String getString(String path, String defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getString(fullPath);
            }
        } catch (Exception e) {
            log.debug("Error reading config path {}: {}", fullPath, e.getMessage());
        }
        return defaultValue;
    }

    private int getInt(String path, int defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getInt(fullPath);
            }
        } catch (Exception e) {
            log.debug("Error reading config path {}: {}", fullPath, e.getMessage());
        }
        return defaultValue;
    }

    private boolean getBoolean(String path, boolean defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            if (config.hasPath(fullPath)) {
                return config.getBoolean(fullPath);
            }
        } catch (Exception e) {
            log.debug("Error reading config path {}: {}", fullPath, e.getMessage());
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "RelayConfig{" +
                "rulesFile='" + getRulesFile() + '\'' +
                ", proxy='" + getProxyHost() + ":" + getProxyPort() + '\'' +
                ", dryRun=" + isDryRun() +
                ", suppressSingleStatSuffix=" + isSuppressSingleStatSuffix() +
                ", metricPrefix='" + getMetricPrefix() + '\'' +
                ", defaultDelayMinutes=" + getDefaultDelayMinutes() +
                ", fetchThreads=" + getFetchThreads() +
                '}';
    }
}
