package io.cwrelay.core;

import io.cwrelay.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Computes the polling window from the stored watermark and commits the new one.
 */
public class WindowManager {

    private static final Logger log = LoggerFactory.getLogger(WindowManager.class);

    static final Duration MAX_LOOKBACK = Duration.ofHours(24);

    private final WatermarkStore store;

    public WindowManager(WatermarkStore store) {
        this.store = store;
    }

    /**
     * @param watermark end of the last successful window, null on the first run
     */
    public TimeWindow computeWindow(Instant now, Instant watermark, int defaultDelayMinutes) {
        Instant start;
        if (watermark == null) {
            start = now.minus(Duration.ofMinutes(defaultDelayMinutes));
        } else {
            start = watermark;
            if (Duration.between(start, now).compareTo(MAX_LOOKBACK) > 0) {
                Instant clamped = now.minus(MAX_LOOKBACK);
                log.warn("Watermark {} is older than {}; starting at {}", watermark, MAX_LOOKBACK, clamped);
                start = clamped;
            }
        }
        return new TimeWindow(start, now);
    }

    /**
     * Stores {@code end}, truncated to whole seconds, as the new watermark.
     */
    public void commit(Instant end) {
        Instant watermark = end.truncatedTo(ChronoUnit.SECONDS);
        store.saveWatermark(watermark);
        log.debug("Committed watermark {}", watermark);
    }
}
