package io.cwrelay.core.sink;

import io.cwrelay.core.model.OutputRecord;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Formats records in the Wavefront proxy line protocol:
 * {@code <name> <value> <timestampSeconds> source=<source>[ <key>=<value>]*}.
 *
 * Names, sources and tags are written as they are. Whitespace or '=' inside them
 * produce a line the proxy cannot parse.
 */
public final class WavefrontLineFormat {

    private WavefrontLineFormat() {
    }

    /**
     * The line for {@code record}, without the trailing newline.
     */
    public static String format(OutputRecord record) {
        StringBuilder line = new StringBuilder(128)
                .append(record.name()).append(' ')
                .append(formatValue(record.value())).append(' ')
                .append(Math.floorDiv(record.timestampMillis(), 1000L))
                .append(" source=").append(record.source());
        if (record.pointTags() != null) {
            for (Map.Entry<String, String> tag : record.pointTags().entrySet()) {
                line.append(' ').append(tag.getKey()).append('=').append(tag.getValue());
            }
        }
        return line.toString();
    }

    static String formatValue(double value) {
        String text = Double.toString(value);
        if (Double.isNaN(value) || Double.isInfinite(value) || text.indexOf('E') < 0) {
            return text;
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
