package io.cwrelay.core.model;

import java.time.Instant;

/**
 * Half open {@code [start, end)} range covered by one poll cycle.
 */
public record TimeWindow(Instant start, Instant end) {
}
