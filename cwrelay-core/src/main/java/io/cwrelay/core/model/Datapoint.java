package io.cwrelay.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Statistic values for one period of one series.
 */
public record Datapoint(Instant timestamp, Map<StatKind, Double> values) {

    public Datapoint {
        values = values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(values));
    }
}
