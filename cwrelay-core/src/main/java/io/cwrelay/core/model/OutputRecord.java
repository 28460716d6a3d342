package io.cwrelay.core.model;

import java.util.Map;

/**
 * One flat telemetry point handed to a sink.
 *
 * @param pointTags insertion ordered tags, {@code Namespace} first
 */
public record OutputRecord(String name, double value, long timestampMillis, String source, Map<String, String> pointTags) {
}
