package com.callplatform.guardsvc.domain.guard;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.blocking.BlockingRule;
import com.callplatform.guardsvc.domain.blocking.BlockingRuleType;
import com.callplatform.guardsvc.domain.bypass.BypassAttempt;
import com.callplatform.guardsvc.domain.bypass.BypassType;
import com.callplatform.guardsvc.domain.captcha.Difficulty;
import com.callplatform.guardsvc.domain.geo.GeoBlockRule;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.model.UserRole;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.http.RequestHeaders;
import com.callplatform.guardsvc.support.GuardFixture;
import com.callplatform.guardsvc.support.StubGeoReputationProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestGuardTest {

    private static final String IP = "198.51.100.100";

    private GuardFixture fixture;
    private RequestGuard guard;

    @BeforeEach
    void setUp() {
        fixture = new GuardFixture();
        guard = fixture.requestGuard;
    }

    private static GuardRequest get(String path, UserContext context) {
        return new GuardRequest("GET", path, context, RequestHeaders.empty());
    }

    @Test
    void anonymousCallerGetsTenRequestsPerMinute() {
        UserContext caller = UserContext.anonymous(IP);

        for (int i = 0; i < 10; i++) {
            GuardDecision decision = guard.evaluate(get("/api/v1/campaigns", caller));
            assertThat(decision.outcome()).isEqualTo(GuardOutcome.ALLOWED);
            assertThat(decision.identifier()).isEqualTo("ip:" + IP);
            assertThat(decision.rateLimit().remaining()).isEqualTo(9 - i);
            fixture.clock.advance(Duration.ofMillis(1500));
        }

        GuardDecision denied = guard.evaluate(get("/api/v1/campaigns", caller));

        assertThat(denied.outcome()).isEqualTo(GuardOutcome.RATE_LIMITED);
        assertThat(denied.outcome().httpStatus()).isEqualTo(429);
        assertThat(denied.permitted()).isFalse();
        assertThat(denied.reason()).isEqualTo("Rate limit exceeded");
        assertThat(denied.retryAfter()).isNotNull().isPositive();
        assertThat(denied.captcha().required()).isFalse();
        assertThat(fixture.counter("guard.decisions.total", "outcome", "rate_limited")).isEqualTo(1.0);
    }

    @Test
    void authenticatedBuyerUsesTheBuyerTier() {
        UserContext buyer = UserContext.authenticated("buyer-1", UserRole.BUYER, IP);

        GuardDecision decision = guard.evaluate(get("/api/v1/calls", buyer));

        assertThat(decision.identifier()).isEqualTo("user:buyer-1");
        assertThat(decision.rateLimit().limit()).isEqualTo(120);
    }

    @Test
    void skippedMethodsAndPathsAreNotEvaluated() {
        UserContext caller = UserContext.anonymous(IP);

        assertThat(guard.evaluate(new GuardRequest("options", "/api/v1/x", caller, null))).isEqualTo(GuardDecision.SKIP);
        assertThat(guard.evaluate(get("/actuator/health", caller))).isEqualTo(GuardDecision.SKIP);
        assertThat(guard.evaluate(get("/api/v1/captcha", caller))).isEqualTo(GuardDecision.SKIP);
        assertThat(guard.evaluate(get("/actuatorx", caller)).outcome()).isEqualTo(GuardOutcome.ALLOWED);
        assertThat(fixture.geoProvider.lookups()).isEqualTo(1);
    }

    @Test
    void geoRuleBlocksBeforeAnythingIsCounted() {
        fixture.geoProvider.answer(StubGeoReputationProvider.located("203.0.113.200", "Russia", "RU", 1.0));
        fixture.geoIpAnalyzer.replaceRules(List.of(GeoBlockRule.block("block-ru", Set.of("RU"), null, 10)));

        GuardDecision decision = guard.evaluate(get("/api/v1/campaigns", UserContext.anonymous("203.0.113.200")));

        assertThat(decision.outcome()).isEqualTo(GuardOutcome.GEO_BLOCKED);
        assertThat(decision.outcome().httpStatus()).isEqualTo(403);
        assertThat(decision.ruleId()).isEqualTo("block-ru");
        assertThat(decision.rateLimit()).isNull();
    }

    @Test
    void blockingRuleRejectsTheIp() {
        BlockingRule rule = fixture.blockingRuleService.createRule(BlockingRuleType.IP, IP, "Chargeback fraud", false, false);

        GuardDecision decision = guard.evaluate(get("/api/v1/campaigns", UserContext.anonymous(IP)));

        assertThat(decision.outcome()).isEqualTo(GuardOutcome.RULE_BLOCKED);
        assertThat(decision.ruleId()).isEqualTo(rule.id());
        assertThat(decision.reason()).isEqualTo("Chargeback fraud");
    }

    @Test
    void criticalReputationIsAutoBlocked() {
        fixture.geoProvider.answer(StubGeoReputationProvider.torExit("203.0.113.201", "Iran", "IR"));

        GuardDecision decision = guard.evaluate(get("/api/v1/campaigns", UserContext.anonymous("203.0.113.201")));

        assertThat(decision.outcome()).isEqualTo(GuardOutcome.RULE_BLOCKED);
        assertThat(decision.reason()).startsWith("Critical IP reputation");
        assertThat(fixture.blockingRuleService.listActive(BlockingRuleType.IP))
                .singleElement()
                .satisfies(rule -> assertThat(rule.autoBlocked()).isTrue());
    }

    @Test
    void bypassPenaltyShrinksTheAllowanceAndDenialMarksTheAttempt() {
        UserContext caller = UserContext.anonymous(IP);
        GuardRequest request = new GuardRequest("GET", "/api/v1/campaigns", caller,
                RequestHeaders.of(Map.of("X-Bypass-Rate-Limit", "yes")));

        GuardDecision first = guard.evaluate(request);
        guard.evaluate(request);
        GuardDecision third = guard.evaluate(request);

        assertThat(first.rateLimit().limit()).isEqualTo(2);
        assertThat(first.bypass().bypassType()).isEqualTo(BypassType.HEADER_MANIPULATION);
        assertThat(third.outcome()).isEqualTo(GuardOutcome.RATE_LIMITED);
        assertThat(fixture.bypassDetector.getBypassAttempts(BypassType.HEADER_MANIPULATION))
                .extracting(BypassAttempt::blocked)
                .contains(true);
    }

    @Test
    void denialForSuspiciousIpAsksForCaptcha() {
        fixture.rateLimitService.addSuspiciousIP(IP, null);
        UserContext caller = UserContext.anonymous(IP);
        for (int i = 0; i < 10; i++) {
            guard.evaluate(get("/api/v1/campaigns", caller));
        }

        GuardDecision denied = guard.evaluate(get("/api/v1/campaigns", caller));

        assertThat(denied.outcome()).isEqualTo(GuardOutcome.CAPTCHA_REQUIRED);
        assertThat(denied.reason()).isEqualTo("Suspicious IP address");
        assertThat(denied.captcha().difficulty()).isEqualTo(Difficulty.MEDIUM);
        assertThat(denied.retryAfter()).isPositive();
    }

    @Test
    void highThreatLocationEscalatesToHardCaptcha() {
        fixture.geoProvider.answer(StubGeoReputationProvider.located("203.0.113.202", "Russia", "RU", 5.0));
        UserContext caller = UserContext.anonymous("203.0.113.202");
        for (int i = 0; i < 10; i++) {
            guard.evaluate(get("/api/v1/campaigns", caller));
        }

        GuardDecision denied = guard.evaluate(get("/api/v1/campaigns", caller));

        assertThat(denied.outcome()).isEqualTo(GuardOutcome.CAPTCHA_REQUIRED);
        assertThat(denied.captcha().difficulty()).isEqualTo(Difficulty.HARD);
        assertThat(denied.reason()).isEqualTo("High threat location: high");
    }

    @Test
    void storeOutageFailsOpen() {
        GuardFixture failing = GuardFixture.failingStore();

        GuardDecision decision = failing.requestGuard.evaluate(get("/api/v1/campaigns", UserContext.anonymous(IP)));

        assertThat(decision.outcome()).isEqualTo(GuardOutcome.ALLOWED);
        assertThat(decision.degraded()).isTrue();
        assertThat(decision.rateLimit().remaining()).isEqualTo(9);
        assertThat(failing.counter("guard.fail_open.total", "component", "rate-limiter")).isEqualTo(1.0);
    }

    @Test
    void missingContextIsRejected() {
        assertThatThrownBy(() -> guard.evaluate(new GuardRequest("GET", "/", null, null)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void malformedIpFailsOpenUnlessInputIsStrict() {
        UserContext bogus = UserContext.anonymous("not-an-ip");

        GuardDecision lenient = guard.evaluate(get("/api/v1/campaigns", bogus));
        assertThat(lenient.outcome()).isEqualTo(GuardOutcome.ALLOWED);
        assertThat(lenient.degraded()).isTrue();
        assertThat(fixture.counter("guard.fail_open.total", "component", "orchestration")).isEqualTo(1.0);

        GuardProperties strict = new GuardProperties();
        strict.getOrchestration().setStrictInput(true);
        GuardFixture strictFixture = new GuardFixture(strict);
        assertThatThrownBy(() -> strictFixture.requestGuard.evaluate(get("/api/v1/campaigns", bogus)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void attackModeShedsAnonymousThenAuthenticatedCallers() {
        GuardProperties properties = new GuardProperties();
        properties.getDdos().setEnabled(true);
        properties.getDdos().setCriticalThreshold(2);
        GuardFixture attacked = new GuardFixture(properties);
        RequestGuard underAttack = attacked.requestGuard;

        underAttack.evaluate(get("/api/v1/a", UserContext.anonymous("203.0.113.1")));
        underAttack.evaluate(get("/api/v1/a", UserContext.anonymous("203.0.113.2")));

        GuardDecision anonymous = underAttack.evaluate(get("/api/v1/a", UserContext.anonymous("203.0.113.3")));
        assertThat(anonymous.outcome()).isEqualTo(GuardOutcome.AUTHENTICATION_REQUIRED);
        assertThat(anonymous.retryAfter()).isEqualTo(300L);

        GuardDecision buyer = underAttack.evaluate(
                get("/api/v1/a", UserContext.authenticated("b-1", UserRole.BUYER, "203.0.113.4")));
        assertThat(buyer.outcome()).isEqualTo(GuardOutcome.EMERGENCY_MODE);
        assertThat(buyer.outcome().httpStatus()).isEqualTo(503);

        GuardDecision admin = underAttack.evaluate(
                get("/api/v1/a", UserContext.authenticated("ops", UserRole.ADMIN, "203.0.113.5")));
        assertThat(admin.outcome()).isEqualTo(GuardOutcome.ALLOWED);
    }

    @Test
    void outcomesFeedBehaviorAnalysis() {
        UserContext caller = UserContext.anonymous(IP);
        GuardRequest request = get("/api/v1/campaigns", caller);
        GuardDecision decision = guard.evaluate(request);

        guard.recordOutcome(request, decision, 200, 12);
        guard.recordOutcome(get("/actuator/health", caller), GuardDecision.SKIP, 200, 1);

        assertThat(fixture.behavioralAnalyzer.countRecent("ip:" + IP, Duration.ofMinutes(1))).isEqualTo(1);
    }

    @Test
    void recordingNeverThrows() {
        GuardFixture failing = GuardFixture.failingStore();
        GuardRequest request = get("/api/v1/campaigns", UserContext.anonymous(IP));

        failing.requestGuard.recordOutcome(request, GuardDecision.failOpen(null), 500, -3);
    }
}
