package io.cwrelay.core;

import io.cwrelay.core.model.TimeWindow;

/**
 * Counters for one completed poll cycle.
 */
public record PollSummary(TimeWindow window, int pages, int descriptors, int matched, long records) {
}
