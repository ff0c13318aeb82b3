package com.callplatform.guardsvc.property;

import com.callplatform.guardsvc.domain.geo.GeoBlockDecision;
import com.callplatform.guardsvc.domain.geo.GeoBlockRule;
import com.callplatform.guardsvc.domain.geo.GeoLocation;
import com.callplatform.guardsvc.domain.geo.GeoRuleEvaluator;
import com.callplatform.guardsvc.domain.geo.GeoRuleType;
import com.callplatform.guardsvc.domain.model.ThreatLevel;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for geo rule evaluation.
 * Feature: abuse-guard
 */
class GeoRulePropertyTest {

    // Property 6: Geo Rule Determinism
    @Property(tries = 200)
    @Tag("Feature: abuse-guard, Property 6: Geo Rule Determinism")
    @Label("Property 6: Rule order in the list does not change the decision")
    void decisionIgnoresListOrder(
            @ForAll("ruleSets") List<GeoBlockRule> rules,
            @ForAll("locations") GeoLocation location,
            @ForAll long seed) {

        List<GeoBlockRule> shuffled = new ArrayList<>(rules);
        Collections.shuffle(shuffled, new Random(seed));

        GeoBlockDecision original = GeoRuleEvaluator.evaluate(rules, location);
        GeoBlockDecision reordered = GeoRuleEvaluator.evaluate(shuffled, location);

        assertThat(reordered).isEqualTo(original);
    }

    @Property(tries = 200)
    @Tag("Feature: abuse-guard, Property 6: Geo Rule Determinism")
    @Label("Property 6: A blocking decision always names an enabled block rule")
    void blockNamesEnabledBlockRule(
            @ForAll("ruleSets") List<GeoBlockRule> rules,
            @ForAll("locations") GeoLocation location) {

        GeoBlockDecision decision = GeoRuleEvaluator.evaluate(rules, location);

        if (decision.blocked()) {
            assertThat(rules)
                    .filteredOn(rule -> rule.id().equals(decision.ruleId()))
                    .singleElement()
                    .satisfies(rule -> {
                        assertThat(rule.type()).isEqualTo(GeoRuleType.BLOCK);
                        assertThat(rule.enabled()).isTrue();
                    });
            assertThat(decision.reason()).startsWith("Access from ");
        } else {
            assertThat(decision.reason()).isNull();
        }
    }

    // Property 7: Allow-Only Rule Sets Never Block
    @Property(tries = 100)
    @Tag("Feature: abuse-guard, Property 7: Allow-Only Rule Sets Never Block")
    @Label("Property 7: Without block rules every location is allowed")
    void allowRulesNeverBlock(
            @ForAll("ruleSets") List<GeoBlockRule> rules,
            @ForAll("locations") GeoLocation location) {

        List<GeoBlockRule> allowOnly = rules.stream()
                .filter(rule -> rule.type() == GeoRuleType.ALLOW)
                .toList();

        assertThat(GeoRuleEvaluator.evaluate(allowOnly, location).blocked()).isFalse();
    }

    @Provide
    Arbitrary<List<GeoBlockRule>> ruleSets() {
        Arbitrary<GeoBlockRule> rule = Combinators.combine(
                        Arbitraries.strings().withCharRange('a', 'z').ofLength(6),
                        Arbitraries.of(GeoRuleType.class),
                        Arbitraries.of("US", "RU", "CN", "DE", "IR").set().ofMaxSize(3),
                        Arbitraries.of(ThreatLevel.class).injectNull(0.4),
                        Arbitraries.integers().between(0, 5),
                        Arbitraries.of(true, true, false))
                .as((id, type, countries, floor, priority, enabled) -> new GeoBlockRule(
                        id, type, countries, new GeoBlockRule.Conditions(floor), priority, enabled));
        return rule.list().ofMaxSize(8).uniqueElements(GeoBlockRule::id);
    }

    @Provide
    Arbitrary<GeoLocation> locations() {
        return Combinators.combine(
                        Arbitraries.of("US", "RU", "CN", "DE", "IR", "BR"),
                        Arbitraries.of(ThreatLevel.class))
                .as((code, level) -> new GeoLocation(
                        "203.0.113.7", code + "-land", code, null, level, 50, false, false, false));
    }
}
