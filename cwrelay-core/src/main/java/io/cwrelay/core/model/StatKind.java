package io.cwrelay.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Statistic kinds that can be requested from the upstream provider.
 * Each kind carries its upstream name and the short label appended to output metric names.
 */
public enum StatKind {
    AVERAGE("Average", "avg"),
    MAXIMUM("Maximum", "max"),
    MINIMUM("Minimum", "min"),
    SUM("Sum", "sum"),
    SAMPLE_COUNT("SampleCount", "count");

    private final String upstreamName;
    private final String label;

    StatKind(String upstreamName, String label) {
        this.upstreamName = upstreamName;
        this.label = label;
    }

    /**
     * Name used by the upstream API and by rule files, e.g. {@code "SampleCount"}.
     */
    public String upstreamName() {
        return upstreamName;
    }

    /**
     * Abbreviated label used as the metric name suffix, e.g. {@code "count"}.
     */
    public String label() {
        return label;
    }

    public static Optional<StatKind> fromUpstreamName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.upstreamName.equals(name))
                .findFirst();
    }
}
