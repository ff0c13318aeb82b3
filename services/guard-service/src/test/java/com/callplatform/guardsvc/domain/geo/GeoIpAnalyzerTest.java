package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.support.GuardFixture;
import com.callplatform.guardsvc.support.StubGeoReputationProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoIpAnalyzerTest {

    private GuardFixture fixture;
    private GeoIpAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        fixture = new GuardFixture();
        analyzer = fixture.geoIpAnalyzer;
    }

    @Test
    void privateAddressesResolveLocallyWithoutLookup() {
        GeoLocation location = analyzer.analyzeIP("10.0.0.8");

        assertThat(location.countryCode()).isEqualTo(GeoLocation.LOCAL_CODE);
        assertThat(location.threatLevel()).isEqualTo(ThreatLevel.LOW);
        assertThat(location.isResolved()).isFalse();
        assertThat(fixture.geoProvider.lookups()).isZero();
    }

    @Test
    void repeatedLookupsAreServedFromCache() {
        analyzer.analyzeIP("198.51.100.20");
        analyzer.analyzeIP("198.51.100.20");

        assertThat(fixture.geoProvider.lookups()).isEqualTo(1);
    }

    @Test
    void sharedCacheIsVisibleToAnotherInstance() {
        analyzer.analyzeIP("198.51.100.21");
        GeoIpAnalyzer other = new GeoIpAnalyzer(fixture.store, fixture.geoProvider,
                new GeoThreatAssessor(fixture.properties), fixture.objectMapper, fixture.securityUtils,
                fixture.metrics, fixture.properties);

        GeoLocation location = other.analyzeIP("198.51.100.21");

        assertThat(location.countryCode()).isEqualTo("US");
        assertThat(fixture.geoProvider.lookups()).isEqualTo(1);
    }

    @Test
    void evictForcesAFreshLookup() {
        analyzer.analyzeIP("198.51.100.22");
        analyzer.evict("198.51.100.22");
        analyzer.analyzeIP("198.51.100.22");

        assertThat(fixture.geoProvider.lookups()).isEqualTo(2);
    }

    @Test
    void providerOutageDegradesToUnknownLowThreat() {
        fixture.geoProvider.setFailing(true);

        GeoLocation location = analyzer.analyzeIP("198.51.100.23");

        assertThat(location.countryCode()).isEqualTo(GeoLocation.UNKNOWN_CODE);
        assertThat(location.threatLevel()).isEqualTo(ThreatLevel.LOW);
        assertThat(fixture.counter("guard.fail_open.total", "component", "geo-provider")).isEqualTo(1.0);
    }

    @Test
    void rejectsMissingOrMalformedAddresses() {
        assertThatThrownBy(() -> analyzer.analyzeIP(" "))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> analyzer.analyzeIP("not-an-ip"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void blocksByReplacedRuleSet() {
        fixture.geoProvider.answer(StubGeoReputationProvider.located("203.0.113.44", "Russia", "RU", 1.0));
        analyzer.replaceRules(List.of(GeoBlockRule.block("block-ru", Set.of("RU"), null, 10)));

        GeoBlockDecision decision = analyzer.shouldBlockIP("203.0.113.44");

        assertThat(decision.blocked()).isTrue();
        assertThat(decision.ruleId()).isEqualTo("block-ru");
        assertThat(analyzer.shouldBlockIP("198.51.100.30").blocked()).isFalse();
    }

    @Test
    void duplicateRuleIdsAreRejected() {
        List<GeoBlockRule> rules = List.of(
                GeoBlockRule.block("dup", Set.of("RU"), null, 1),
                GeoBlockRule.allow("dup", Set.of("DE"), 2));

        assertThatThrownBy(() -> analyzer.replaceRules(rules))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("dup");
    }

    @Test
    void configuredDefaultsApplyWhenNothingIsStored() {
        GuardProperties properties = new GuardProperties();
        properties.getGeo().getDefaultRules().add(
                new GuardProperties.GeoRule("block-critical", "block", List.of(), ThreatLevel.CRITICAL, 100, true));
        GuardFixture withDefaults = new GuardFixture(properties);
        withDefaults.geoProvider.answer(StubGeoReputationProvider.torExit("203.0.113.66", "Iran", "IR"));

        GeoBlockDecision decision = withDefaults.geoIpAnalyzer.shouldBlockIP("203.0.113.66");

        assertThat(withDefaults.geoIpAnalyzer.getRules()).extracting(GeoBlockRule::id).containsExactly("block-critical");
        assertThat(decision.blocked()).isTrue();
    }

    @Test
    void storeOutageStillAllows() {
        GuardFixture failing = GuardFixture.failingStore();

        GeoBlockDecision decision = failing.geoIpAnalyzer.shouldBlockIP("198.51.100.40");

        assertThat(decision.blocked()).isFalse();
        assertThat(failing.geoProvider.lookups()).isEqualTo(1);
    }
}
