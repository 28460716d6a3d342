package io.cwrelay.core;

import java.time.Instant;

/**
 * Persists the end of the last successful poll window.
 */
public interface WatermarkStore {

    /**
     * Replaces the stored watermark with {@code watermark}, leaving other stored state untouched.
     */
    void saveWatermark(Instant watermark);
}
