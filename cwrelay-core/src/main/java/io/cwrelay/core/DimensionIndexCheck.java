package io.cwrelay.core;

import java.util.Locale;

/**
 * Bounds check applied to {@code DimensionIndex} source directives.
 */
public enum DimensionIndexCheck {
    /**
     * Accepts the index only when the dimension count is smaller than it, as rule files
     * written for the shell tool expect. Such an index is never in range, so the directive
     * never yields a value.
     */
    LITERAL,
    /**
     * Accepts the index when {@code 0 <= index < count}.
     */
    IN_RANGE;

    public static DimensionIndexCheck parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "literal" -> LITERAL;
            case "in-range", "in_range" -> IN_RANGE;
            default -> throw new ConfigurationException("Unknown dimension-index-check: " + value);
        };
    }
}
