package io.cwrelay.core.model;

import java.util.List;

/**
 * One way of deriving the source of a record.
 */
public sealed interface SourceDirective
        permits SourceDirective.TagName, SourceDirective.DimensionIndex, SourceDirective.Literal {

    List<SourceDirective> DEFAULTS = List.of(
            new TagName("Service"),
            new TagName("AvailabilityZone"),
            new DimensionIndex(0),
            new Literal("AWS"));

    /** Looks up a point tag. */
    record TagName(String name) implements SourceDirective {
    }

    /** Picks the raw value of the n-th dimension. */
    record DimensionIndex(int index) implements SourceDirective {
    }

    /** Fixed value. */
    record Literal(String value) implements SourceDirective {
    }
}
