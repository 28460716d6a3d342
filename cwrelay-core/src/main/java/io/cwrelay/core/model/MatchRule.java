package io.cwrelay.core.model;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * A configured rule selecting metrics by a regular expression over the composite key.
 *
 * @param stats            statistics to request, in configured order and without duplicates
 * @param sourceDirectives directives for the source, empty when the rule relies on the defaults
 */
public record MatchRule(String pattern, Pattern compiled, List<StatKind> stats,
                        List<SourceDirective> sourceDirectives, OptionalInt priority) {

    public MatchRule {
        stats = List.copyOf(stats);
        sourceDirectives = sourceDirectives == null ? List.of() : List.copyOf(sourceDirectives);
        priority = priority == null ? OptionalInt.empty() : priority;
    }

    public MatchRule(String pattern, List<StatKind> stats, List<SourceDirective> sourceDirectives, OptionalInt priority) {
        this(pattern, Pattern.compile(pattern, Pattern.CASE_INSENSITIVE), stats, sourceDirectives, priority);
    }

    /**
     * True when the pattern matches at the beginning of the key. The whole key need not be consumed.
     */
    public boolean matches(String compositeKey) {
        return compiled.matcher(compositeKey).lookingAt();
    }
}
