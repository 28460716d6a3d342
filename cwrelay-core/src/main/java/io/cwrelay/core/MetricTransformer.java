package io.cwrelay.core;

import io.cwrelay.core.model.Datapoint;
import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.MetricDescriptor;
import io.cwrelay.core.model.MetricDescriptor.Dimension;
import io.cwrelay.core.model.OutputRecord;
import io.cwrelay.core.model.TimeWindow;
import io.cwrelay.core.provider.MetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns one metric descriptor into output records.
 *
 * Work is split in two steps so statistics can be fetched on worker threads while
 * records are still emitted in a fixed order:
 * <ol>
 *   <li>{@link #fetch} matches the descriptor to a rule and calls the upstream provider</li>
 *   <li>{@link #records} resolves the source and fans the datapoints out into records</li>
 * </ol>
 */
public class MetricTransformer {

    private static final Logger log = LoggerFactory.getLogger(MetricTransformer.class);

    public static final int DEFAULT_PERIOD_SECONDS = 60;

    private final ConfigMatcher matcher;
    private final SourceResolver sourceResolver;
    private final MetricsProvider provider;
    private final Retrier retrier;
    private final String metricPrefix;
    private final boolean suppressSingleStatSuffix;
    private final int periodSeconds;

    public MetricTransformer(ConfigMatcher matcher, SourceResolver sourceResolver, MetricsProvider provider,
                             Retrier retrier, String metricPrefix, boolean suppressSingleStatSuffix,
                             int periodSeconds) {
        this.matcher = matcher;
        this.sourceResolver = sourceResolver;
        this.provider = provider;
        this.retrier = retrier;
        this.metricPrefix = metricPrefix == null ? "" : metricPrefix;
        this.suppressSingleStatSuffix = suppressSingleStatSuffix;
        this.periodSeconds = periodSeconds;
    }

    public MetricTransformer(ConfigMatcher matcher, SourceResolver sourceResolver, MetricsProvider provider,
                             String metricPrefix, boolean suppressSingleStatSuffix) {
        this(matcher, sourceResolver, provider, Retrier.none(), metricPrefix, suppressSingleStatSuffix,
                DEFAULT_PERIOD_SECONDS);
    }

    /**
     * Matches and fetches, then fans out. Equivalent to {@code fetch(...).map(this::records)}.
     */
    public Stream<OutputRecord> transform(MetricDescriptor descriptor, TimeWindow window) {
        return fetch(descriptor, window).map(this::records).orElseGet(Stream::empty);
    }

    /**
     * Matches the descriptor and retrieves its statistics. Empty when no rule applies.
     *
     * @throws UpstreamException when the provider keeps failing
     */
    public Optional<FetchedMetric> fetch(MetricDescriptor descriptor, TimeWindow window) {
        Optional<MatchRule> match = matcher.match(descriptor.namespace(), descriptor.metricName());
        if (match.isEmpty()) {
            return Optional.empty();
        }
        MatchRule rule = match.get();
        List<Datapoint> datapoints;
        try {
            datapoints = retrier.call("Statistics for " + descriptor.compositeKey(),
                    () -> provider.getStatistics(descriptor, window.start(), window.end(), periodSeconds, rule.stats()));
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException("Failed to get statistics for " + descriptor.compositeKey(), e);
        }
        return Optional.of(new FetchedMetric(descriptor, rule, datapoints));
    }

    /**
     * Fans fetched datapoints out into records, datapoints in provider order and statistics
     * in rule order. Empty, with a warning, when no source can be resolved.
     */
    public Stream<OutputRecord> records(FetchedMetric fetched) {
        MetricDescriptor descriptor = fetched.descriptor();
        MatchRule rule = fetched.rule();
        Map<String, String> pointTags = pointTags(descriptor);

        Optional<String> source = sourceResolver.resolve(rule.sourceDirectives(), pointTags, descriptor.dimensions());
        if (source.isEmpty()) {
            log.warn("Source is not found in {}", descriptor);
            return Stream.empty();
        }

        String baseName = metricPrefix + descriptor.compositeKey();
        boolean bareName = rule.stats().size() == 1 && suppressSingleStatSuffix;

        return fetched.datapoints().stream()
                .flatMap(dp -> rule.stats().stream()
                        .filter(stat -> dp.values().containsKey(stat))
                        .map(stat -> new OutputRecord(
                                bareName ? baseName : baseName + "." + stat.label(),
                                dp.values().get(stat),
                                dp.timestamp().toEpochMilli(),
                                source.get(),
                                pointTags)));
    }

    static Map<String, String> pointTags(MetricDescriptor descriptor) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("Namespace", descriptor.namespace());
        for (Dimension d : descriptor.dimensions()) {
            tags.put(d.name(), d.value());
        }
        return Collections.unmodifiableMap(tags);
    }

    /**
     * A matched descriptor together with the datapoints retrieved for it.
     */
    public record FetchedMetric(MetricDescriptor descriptor, MatchRule rule, List<Datapoint> datapoints) {
    }
}
