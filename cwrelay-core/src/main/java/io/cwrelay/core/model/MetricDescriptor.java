package io.cwrelay.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one upstream time series, independent of time.
 */
public record MetricDescriptor(String namespace, String metricName, List<Dimension> dimensions) {

    public MetricDescriptor {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(metricName, "metricName");
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    /**
     * The lower case {@code namespace.metric} key with '/' replaced by '.'.
     * Used both for rule matching and as the base output name.
     */
    public String compositeKey() {
        return compositeKey(namespace, metricName);
    }

    public static String compositeKey(String namespace, String metricName) {
        return namespace.replace('/', '.').toLowerCase(Locale.ROOT) + "." + metricName.toLowerCase(Locale.ROOT);
    }

    public record Dimension(String name, String value) {
    }
}
