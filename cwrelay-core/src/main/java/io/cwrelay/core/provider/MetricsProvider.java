package io.cwrelay.core.provider;

import io.cwrelay.core.model.Datapoint;
import io.cwrelay.core.model.MetricDescriptor;
import io.cwrelay.core.model.StatKind;

import java.time.Instant;
import java.util.List;

/**
 * Upstream source of metric descriptors and their statistics.
 * Implementations block and report failures as unchecked exceptions.
 */
public interface MetricsProvider extends AutoCloseable {

    /**
     * @param nextToken continuation token from the previous page, null for the first page
     */
    DescriptorPage listDescriptors(String nextToken);

    /**
     * Datapoints for the series identified by {@code descriptor}, in the order the upstream returns them.
     */
    List<Datapoint> getStatistics(MetricDescriptor descriptor, Instant start, Instant end,
                                  int periodSeconds, List<StatKind> stats);

    @Override
    default void close() {
    }
}
