package io.cwrelay.core;

import io.cwrelay.core.model.MatchRule;
import io.cwrelay.core.model.StatKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ConfigMatcherTest {

    private static MatchRule rule(String pattern, Integer priority, StatKind... stats) {
        return new MatchRule(pattern, List.of(stats), List.of(),
                priority == null ? OptionalInt.empty() : OptionalInt.of(priority));
    }

    @Test
    @DisplayName("Should return the same rule across repeated calls")
    void deterministic() {
        ConfigMatcher matcher = new ConfigMatcher(List.of(
                rule("aws\\.ec2\\..*", 1, StatKind.AVERAGE),
                rule("aws\\.ec2\\.cpu.*", 2, StatKind.MAXIMUM)));

        Optional<MatchRule> first = matcher.match("AWS/EC2", "CPUUtilization");
        for (int i = 0; i < 10; i++) {
            assertEquals(first, matcher.match("AWS/EC2", "CPUUtilization"));
        }
        assertEquals("aws\\.ec2\\.cpu.*", first.orElseThrow().pattern());
    }

    @Test
    @DisplayName("Rule without priority is never replaced once selected")
    void unprioritizedRuleIsSticky() {
        MatchRule general = rule("aws\\.ec2\\..*", null, StatKind.AVERAGE);
        MatchRule specific = rule("aws\\.ec2\\.cpu.*", 5, StatKind.MAXIMUM);

        ConfigMatcher matcher = new ConfigMatcher(List.of(general, specific));

        assertSame(general, matcher.match("AWS/EC2", "CPUUtilization").orElseThrow());
    }

    @Test
    @DisplayName("Prioritized rule found first is kept unless a later rule has a greater priority")
    void reversedOrderKeepsPriorityRule() {
        MatchRule general = rule("aws\\.ec2\\..*", null, StatKind.AVERAGE);
        MatchRule specific = rule("aws\\.ec2\\.cpu.*", 5, StatKind.MAXIMUM);

        assertSame(specific, new ConfigMatcher(List.of(specific, general))
                .match("AWS/EC2", "CPUUtilization").orElseThrow());

        MatchRule lower = rule("aws\\.ec2\\.c.*", 3, StatKind.SUM);
        assertSame(specific, new ConfigMatcher(List.of(specific, lower))
                .match("AWS/EC2", "CPUUtilization").orElseThrow());

        MatchRule higher = rule("aws\\.ec2\\.c.*", 9, StatKind.SUM);
        assertSame(higher, new ConfigMatcher(List.of(specific, higher))
                .match("AWS/EC2", "CPUUtilization").orElseThrow());
    }

    @Test
    @DisplayName("Equal priority does not replace the current match")
    void equalPriorityKeepsFirst() {
        MatchRule a = rule("aws\\..*", 4, StatKind.AVERAGE);
        MatchRule b = rule("aws\\.ec2.*", 4, StatKind.SUM);

        assertSame(a, new ConfigMatcher(List.of(a, b)).match("AWS/EC2", "NetworkIn").orElseThrow());
    }

    @Test
    @DisplayName("Should match case-insensitively at the start of the composite key")
    void prefixMatchIgnoringCase() {
        ConfigMatcher matcher = new ConfigMatcher(List.of(rule("AWS\\.ELB", null, StatKind.SUM)));

        assertTrue(matcher.match("AWS/ELB", "RequestCount").isPresent());
        assertTrue(matcher.match("aws/elb", "Latency").isPresent());
        assertTrue(matcher.match("Custom/AWS/ELB", "Latency").isEmpty(), "Pattern must match at the beginning");
    }

    @Test
    @DisplayName("Should return empty when nothing matches")
    void noMatch() {
        ConfigMatcher matcher = new ConfigMatcher(List.of(rule("aws\\.rds\\..*", 1, StatKind.AVERAGE)));

        assertTrue(matcher.match("AWS/EC2", "CPUUtilization").isEmpty());
    }

    @Test
    @DisplayName("Rule with no statistics counts as no match")
    void emptyStatsIsNoMatch() {
        ConfigMatcher matcher = new ConfigMatcher(List.of(rule("aws\\.ec2\\..*", null)));

        assertTrue(matcher.match("AWS/EC2", "CPUUtilization").isEmpty());
    }

    @Test
    @DisplayName("Selected rule with empty statistics hides a later lower priority rule")
    void emptyStatsSelectedRuleSkipsDescriptor() {
        ConfigMatcher matcher = new ConfigMatcher(List.of(
                rule("aws\\.ec2\\.cpu.*", 5),
                rule("aws\\.ec2\\..*", 1, StatKind.AVERAGE)));

        assertTrue(matcher.match("AWS/EC2", "CPUUtilization").isEmpty());
        assertTrue(matcher.match("AWS/EC2", "NetworkIn").isPresent());
    }
}
