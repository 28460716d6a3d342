package io.cwrelay.cli.command;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import io.cwrelay.cloudwatch.CloudWatchMetricsProvider;
import io.cwrelay.core.ConfigurationException;
import com.typesafe.config.Config;
import io.cwrelay.core.MetricsRelay;
import io.cwrelay.core.PollSummary;
import io.cwrelay.core.config.RelayConfig;
import io.cwrelay.core.config.RelayProperties;
import io.cwrelay.core.provider.MetricsProvider;
import io.cwrelay.core.sink.WavefrontProxySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Pulls metrics from CloudWatch and pushes them into a Wavefront proxy.
 *
 * Meant to be run from cron, e.g. every 5 minutes:
 * <pre>
 * *&#47;5 * * * * cwrelay aws-metrics --config /opt/wavefront/etc/aws-metrics.json.conf
 * </pre>
 */
public class AwsMetricsCommand implements RelayCommand {

    private static final Logger log = LoggerFactory.getLogger(AwsMetricsCommand.class);

    public static final String NAME = "aws-metrics";
    static final String HELP = "Pull metrics from AWS CloudWatch and push them into Wavefront";

    @Parameters(commandDescription = HELP)
    public static class Args {
        @Parameter(names = "--config", description = "Path to the JSON rule file")
        public String rulesFile;

        @Parameter(names = "--settings", description = "Path to a HOCON settings file")
        public String settings;

        @Parameter(names = "--proxy", description = "Host name (or IP address) and port of the Wavefront proxy, host[:port]")
        public String proxy;

        @Parameter(names = "--dry-run", description = "Don't send data to the proxy, print it to standard output")
        public boolean dryRun;

        @Parameter(names = "--no-suffix-for-single",
                description = "Don't add the statistic suffix when a metric collects a single statistic")
        public boolean noSuffixForSingle;

        @Parameter(names = "--prefix", description = "Add this prefix to the metric names")
        public String prefix;
    }

    private final Args args = new Args();
    private final Function<RelayProperties, MetricsProvider> providerFactory;
    private RelayConfig relayConfig;

    public AwsMetricsCommand() {
        this(props -> CloudWatchMetricsProvider.create(props.getAwsRegion()));
    }

    public AwsMetricsCommand(Function<RelayProperties, MetricsProvider> providerFactory) {
        this.providerFactory = providerFactory;
    }

    @Override
    public Args arguments() {
        return args;
    }

    @Override
    public String helpText() {
        return HELP;
    }

    @Override
    public Config settings() {
        return relayConfig().getConfig();
    }

    @Override
    public int execute() {
        RelayProperties properties = resolveProperties();
        try (MetricsProvider provider = providerFactory.apply(properties)) {
            PollSummary summary = new MetricsRelay(properties, provider).run();
            log.info("Relayed {} records from {} metrics ({} listed) for {} - {}",
                    summary.records(), summary.matched(), summary.descriptors(),
                    summary.window().start(), summary.window().end());
        }
        return 0;
    }

    /**
     * HOCON settings overridden by the flags given on the command line.
     */
    RelayProperties resolveProperties() {
        RelayProperties properties = relayConfig().toProperties();
        if (args.rulesFile != null) {
            properties.setRulesFile(args.rulesFile);
        }
        if (args.proxy != null && !args.proxy.isEmpty()) {
            applyProxy(properties, args.proxy);
        }
        if (args.dryRun) {
            properties.setDryRun(true);
        }
        if (args.noSuffixForSingle) {
            properties.setSuppressSingleStatSuffix(true);
        }
        if (args.prefix != null) {
            properties.setMetricPrefix(args.prefix);
        }
        return properties;
    }

    private RelayConfig relayConfig() {
        if (relayConfig == null) {
            relayConfig = new RelayConfig(args.settings);
        }
        return relayConfig;
    }

    static void applyProxy(RelayProperties properties, String proxy) {
        int colon = proxy.indexOf(':');
        if (colon < 0) {
            properties.setProxyHost(proxy);
            properties.setProxyPort(WavefrontProxySink.DEFAULT_PORT);
            return;
        }
        properties.setProxyHost(proxy.substring(0, colon));
        try {
            properties.setProxyPort(Integer.parseInt(proxy.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid proxy port in '" + proxy + "'", e);
        }
    }
}
