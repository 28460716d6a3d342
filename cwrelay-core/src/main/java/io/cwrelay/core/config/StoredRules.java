package io.cwrelay.core.config;

import io.cwrelay.core.model.MatchRule;

import java.time.Instant;
import java.util.List;

/**
 * Contents of the rule file: the rules in file order and the watermark, if any.
 */
public record StoredRules(List<MatchRule> rules, Instant watermark) {

    public StoredRules {
        rules = List.copyOf(rules);
    }
}
