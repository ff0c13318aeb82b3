package com.callplatform.guardsvc.property;

import com.callplatform.guardsvc.domain.ratelimit.RateLimitConfig;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitResult;
import com.callplatform.guardsvc.support.GuardFixture;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for sliding-window admission.
 * Feature: abuse-guard
 */
class SlidingWindowPropertyTest {

    // Property 1: Window Admission Bound
    @Property(tries = 50)
    @Tag("Feature: abuse-guard, Property 1: Window Admission Bound")
    @Label("Property 1: At most maxRequests are admitted inside one window")
    void admitsAtMostMaxRequests(
            @ForAll @IntRange(min = 1, max = 40) int maxRequests,
            @ForAll @IntRange(min = 1, max = 80) int attempts,
            @ForAll @IntRange(min = 0, max = 500) int spacingMillis) {

        GuardFixture fixture = new GuardFixture();
        RateLimitConfig config = new RateLimitConfig("prop", 60_000, maxRequests);

        int admitted = 0;
        for (int i = 0; i < attempts; i++) {
            RateLimitResult result = fixture.rateLimitService.checkLimit("user:prop", config, null);
            if (result.allowed()) {
                admitted++;
                assertThat(result.remaining()).isBetween(0, maxRequests - 1);
            } else {
                assertThat(result.retryAfter()).isPositive();
            }
            fixture.clock.advanceMillis(spacingMillis);
        }

        // 80 attempts spaced at most 500ms apart stay inside one 60s window
        assertThat(admitted).isEqualTo(Math.min(attempts, maxRequests));
    }

    // Property 2: Window Elapse Restores Quota
    @Property(tries = 50)
    @Tag("Feature: abuse-guard, Property 2: Window Elapse Restores Quota")
    @Label("Property 2: A full window after exhaustion the caller is admitted again")
    void quotaReturnsAfterWindow(
            @ForAll @IntRange(min = 1, max = 20) int maxRequests,
            @ForAll @IntRange(min = 1_000, max = 120_000) int windowMs) {

        GuardFixture fixture = new GuardFixture();
        RateLimitConfig config = new RateLimitConfig("prop", windowMs, maxRequests);
        for (int i = 0; i < maxRequests; i++) {
            fixture.rateLimitService.checkLimit("ip:10.1.1.1", config, null);
        }
        assertThat(fixture.rateLimitService.checkLimit("ip:10.1.1.1", config, null).allowed()).isFalse();

        fixture.clock.advance(Duration.ofMillis(windowMs));

        RateLimitResult result = fixture.rateLimitService.checkLimit("ip:10.1.1.1", config, null);
        assertThat(result.allowed()).isTrue();
        assertThat(result.remaining()).isEqualTo(maxRequests - 1);
    }

    // Property 3: Store Outage Fails Open
    @Property(tries = 50)
    @Tag("Feature: abuse-guard, Property 3: Store Outage Fails Open")
    @Label("Property 3: Every request is admitted as degraded when the store is down")
    void storeOutageAlwaysAdmits(
            @ForAll @IntRange(min = 1, max = 500) int maxRequests,
            @ForAll @IntRange(min = 1, max = 20) int attempts) {

        GuardFixture fixture = GuardFixture.failingStore();
        RateLimitConfig config = new RateLimitConfig("prop", 60_000, maxRequests);

        for (int i = 0; i < attempts; i++) {
            RateLimitResult result = fixture.rateLimitService.checkLimit("user:prop", config, null);
            assertThat(result.allowed()).isTrue();
            assertThat(result.degraded()).isTrue();
            assertThat(result.remaining()).isEqualTo(maxRequests - 1);
        }
        assertThat(fixture.counter("guard.fail_open.total", "component", "rate-limiter")).isEqualTo(attempts);
    }

    // Property 4: Penalty Only Shrinks
    @Property(tries = 200)
    @Tag("Feature: abuse-guard, Property 4: Penalty Only Shrinks")
    @Label("Property 4: A penalty never raises the allowance and never drops it below one")
    void penaltyOnlyShrinks(
            @ForAll @IntRange(min = 1, max = 1_000) int maxRequests,
            @ForAll @DoubleRange(min = 0.0, max = 50.0) double multiplier) {

        RateLimitConfig base = new RateLimitConfig("prop", 60_000, maxRequests);
        RateLimitConfig penalized = base.withPenalty(multiplier);

        assertThat(penalized.maxRequests()).isBetween(1, maxRequests);
        assertThat(penalized.windowMs()).isEqualTo(base.windowMs());
        assertThat(penalized.name()).isEqualTo(base.name());
    }
}
