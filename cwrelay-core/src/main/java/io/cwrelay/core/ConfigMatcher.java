package io.cwrelay.core;

import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.MetricDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Finds the rule that applies to a namespace and metric name.
 */
public class ConfigMatcher {

    private final List<MatchRule> rules;

    /**
     * @param rules rules in rule file order; the order only decides ties
     */
    public ConfigMatcher(List<MatchRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The first matching rule wins unless it declares a priority and a later matching rule
     * declares a greater one. A selected rule without priority is never replaced.
     * Rules with no statistics count as no match.
     */
    public Optional<MatchRule> match(String namespace, String metricName) {
        String key = MetricDescriptor.compositeKey(namespace, metricName);
        MatchRule current = null;
        for (MatchRule rule : rules) {
            if (!rule.matches(key)) {
                continue;
            }
            if (current == null) {
                current = rule;
            } else if (current.priority().isPresent()
                    && rule.priority().isPresent()
                    && current.priority().getAsInt() < rule.priority().getAsInt()) {
                current = rule;
            }
        }
        if (current == null || current.stats().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(current);
    }
}
