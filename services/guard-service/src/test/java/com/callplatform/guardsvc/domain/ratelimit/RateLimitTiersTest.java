package com.callplatform.guardsvc.domain.ratelimit;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitTiersTest {

    private GuardProperties properties;
    private RateLimitTiers tiers;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        tiers = new RateLimitTiers(properties);
    }

    @Test
    void roleDefaultsMatchTheDeployedTable() {
        assertThat(tiers.resolve(UserRole.ANONYMOUS, null)).isEqualTo(new RateLimitConfig("anonymous", 60_000, 10));
        assertThat(tiers.resolve(UserRole.BUYER, null)).isEqualTo(new RateLimitConfig("buyer", 60_000, 120));
        assertThat(tiers.resolve(UserRole.SUPPLIER, null)).isEqualTo(new RateLimitConfig("supplier", 60_000, 180));
        assertThat(tiers.resolve(UserRole.ADMIN, null)).isEqualTo(new RateLimitConfig("admin", 60_000, 300));
    }

    @Test
    void sensitiveEndpointsIgnoreRole() {
        RateLimitConfig anonymousLogin = tiers.resolve(UserRole.ANONYMOUS, "/auth/login");
        RateLimitConfig adminLogin = tiers.resolve(UserRole.ADMIN, "/auth/login/");

        assertThat(anonymousLogin).isEqualTo(adminLogin);
        assertThat(anonymousLogin.name()).isEqualTo("auth-login");
        assertThat(anonymousLogin.maxRequests()).isEqualTo(5);
        assertThat(anonymousLogin.window()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void passwordResetEndpointsShareOneTier() {
        assertThat(tiers.resolve(UserRole.BUYER, "/auth/forgot-password").name())
                .isEqualTo(tiers.resolve(UserRole.BUYER, "/auth/reset-password?token=x").name())
                .isEqualTo("auth-password-reset");
    }

    @Test
    void exactOverrideBeatsPrefixOverrideAndRoleDefault() {
        properties.getRateLimit().getEndpointOverrides().add(
                new GuardProperties.EndpointTier("/api/v1/search", null, "search", 60_000, 30));
        properties.getRateLimit().getEndpointOverrides().add(
                new GuardProperties.EndpointTier("/api/v1/search/export", UserRole.BUYER, "search-export", 60_000, 2));

        assertThat(tiers.resolve(UserRole.BUYER, "/api/v1/search/export").name()).isEqualTo("search-export");
        assertThat(tiers.resolve(UserRole.SUPPLIER, "/api/v1/search/export").name()).isEqualTo("search");
        assertThat(tiers.resolve(UserRole.BUYER, "/api/v1/search/items").name()).isEqualTo("search");
        assertThat(tiers.resolve(UserRole.BUYER, "/api/v1/searching").name()).isEqualTo("buyer");
    }

    @Test
    void missingRoleTierFallsBackToGlobalDefault() {
        properties.getRateLimit().getRoles().remove(UserRole.SUPPLIER);

        assertThat(tiers.resolve(UserRole.SUPPLIER, "/api/v1/calls")).isEqualTo(tiers.globalDefault());
        assertThat(tiers.globalDefault().maxRequests()).isEqualTo(60);
    }

    @Test
    void nullRoleIsTreatedAsAnonymous() {
        assertThat(tiers.resolve(null, "/api/v1/calls").name()).isEqualTo("anonymous");
    }

    @Test
    void penaltyShrinksTheAllowanceButNeverBelowOne() {
        RateLimitConfig buyer = tiers.resolve(UserRole.BUYER, null);

        assertThat(buyer.withPenalty(1.0)).isSameAs(buyer);
        assertThat(buyer.withPenalty(3.0).maxRequests()).isEqualTo(40);
        assertThat(buyer.withPenalty(1000.0).maxRequests()).isEqualTo(1);
        assertThat(buyer.withPenalty(Double.NaN)).isSameAs(buyer);
    }
}
