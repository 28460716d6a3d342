package io.cwrelay.core;

import io.cwrelay.core.config.RelayProperties;
import io.cwrelay.core.config.RuleStore;
import io.cwrelay.core.config.StoredRules;
import io.cwrelay.core.model.SourceDirective;
import io.cwrelay.core.provider.MetricsProvider;
import io.cwrelay.core.sink.DryRunSink;
import io.cwrelay.core.sink.MetricSink;
import io.cwrelay.core.sink.WavefrontProxySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * One relay run: loads the rules, opens the sink, polls once and commits the watermark.
 *
 * Usage:
 * <pre>
 * RelayProperties props = new RelayConfig().toProperties();
 * props.setDryRun(true);
 *
 * MetricsRelay relay = new MetricsRelay(props, provider);
 * PollSummary summary = relay.run();
 * </pre>
 */
public class MetricsRelay {

    private static final Logger log = LoggerFactory.getLogger(MetricsRelay.class);

    private final RelayProperties properties;
    private final MetricsProvider provider;
    private final Clock clock;
    private final Supplier<MetricSink> sinkFactory;

    public MetricsRelay(RelayProperties properties, MetricsProvider provider) {
        this(properties, provider, Clock.systemUTC(), null);
    }

    /**
     * @param sinkFactory opens the sink for the run; null picks the proxy or dry-run sink from the properties
     */
    public MetricsRelay(RelayProperties properties, MetricsProvider provider, Clock clock,
                        Supplier<MetricSink> sinkFactory) {
        this.properties = properties;
        this.provider = provider;
        this.clock = clock;
        this.sinkFactory = sinkFactory != null ? sinkFactory : () -> defaultSink(properties, System.out);
    }

    /**
     * Runs one poll cycle.
     *
     * @throws ConfigurationException before anything is polled when the rules are unusable
     * @throws UpstreamException      when the provider fails; the watermark is not moved
     * @throws SinkException          when records cannot be delivered; the watermark is not moved
     */
    public PollSummary run() {
        RuleStore store = new RuleStore(Path.of(properties.getRulesFile()));
        StoredRules rules = store.load();
        DimensionIndexCheck indexCheck = DimensionIndexCheck.parse(properties.getDimensionIndexCheck());

        Retrier retrier = new Retrier(properties.getMaxRetries(), properties.getRetryDelayMs());
        ConfigMatcher matcher = new ConfigMatcher(rules.rules());
        SourceResolver resolver = new SourceResolver(SourceDirective.DEFAULTS, indexCheck);
        MetricTransformer transformer = new MetricTransformer(matcher, resolver, provider, retrier,
                properties.getMetricPrefix(), properties.isSuppressSingleStatSuffix(), properties.getPeriodSeconds());
        WindowManager windowManager = new WindowManager(store);
        MetricsPoller poller = new MetricsPoller(provider, transformer, windowManager, retrier, clock,
                properties.getDefaultDelayMinutes(), properties.getFetchThreads());

        try (MetricSink sink = sinkFactory.get()) {
            return poller.poll(rules.watermark(), sink);
        }
    }

    static MetricSink defaultSink(RelayProperties properties, PrintStream out) {
        if (properties.isDryRun()) {
            log.info("Dry run: printing lines instead of sending to {}:{}",
                    properties.getProxyHost(), properties.getProxyPort());
            return new DryRunSink(out, properties.getProxyHost(), properties.getProxyPort());
        }
        return WavefrontProxySink.connect(properties.getProxyHost(), properties.getProxyPort(),
                properties.getConnectionTimeoutMs(),
                new Retrier(properties.getMaxRetries(), properties.getRetryDelayMs()));
    }
}
