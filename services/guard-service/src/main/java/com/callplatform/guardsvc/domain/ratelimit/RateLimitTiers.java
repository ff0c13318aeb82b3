package com.callplatform.guardsvc.domain.ratelimit;

import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.model.UserRole;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Static tier table. Precedence: sensitive endpoint, then role endpoint override
 * (exact path before longest prefix), then role default, then the global default.
 */
@Component
public class RateLimitTiers {

    private final GuardProperties.RateLimit properties;

    public RateLimitTiers(GuardProperties properties) {
        this.properties = properties.getRateLimit();
    }

    public RateLimitConfig resolve(UserRole role, String endpointPath) {
        UserRole effectiveRole = role != null ? role : UserRole.ANONYMOUS;
        String path = normalize(endpointPath);

        if (path != null) {
            Optional<GuardProperties.EndpointTier> sensitive = bestMatch(properties.getSensitiveEndpoints(), path, null);
            if (sensitive.isPresent()) {
                return toConfig(sensitive.get());
            }
            Optional<GuardProperties.EndpointTier> override =
                    bestMatch(properties.getEndpointOverrides(), path, effectiveRole);
            if (override.isPresent()) {
                return toConfig(override.get());
            }
        }

        GuardProperties.Tier roleTier = properties.getRoles().get(effectiveRole);
        if (roleTier != null) {
            return toConfig(roleTier);
        }
        return toConfig(properties.getGlobalDefault());
    }

    public RateLimitConfig globalDefault() {
        return toConfig(properties.getGlobalDefault());
    }

    private Optional<GuardProperties.EndpointTier> bestMatch(
            List<GuardProperties.EndpointTier> tiers, String path, UserRole role) {
        return tiers.stream()
                .filter(tier -> tier.getRole() == null || tier.getRole() == role)
                .filter(tier -> matches(normalize(tier.getPath()), path))
                .max(Comparator
                        .comparing((GuardProperties.EndpointTier tier) -> normalize(tier.getPath()).equals(path))
                        .thenComparingInt(tier -> normalize(tier.getPath()).length())
                        .thenComparing(tier -> tier.getRole() != null));
    }

    private static boolean matches(String prefix, String path) {
        if (prefix == null) {
            return false;
        }
        return path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/");
    }

    private static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String trimmed = path.trim();
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            trimmed = trimmed.substring(0, query);
        }
        if (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static RateLimitConfig toConfig(GuardProperties.EndpointTier tier) {
        String name = tier.getName() != null ? tier.getName() : "endpoint" + tier.getPath().replace('/', '-');
        return new RateLimitConfig(name, tier.getWindowMs(), tier.getMaxRequests());
    }

    private static RateLimitConfig toConfig(GuardProperties.Tier tier) {
        return new RateLimitConfig(tier.getName(), tier.getWindowMs(), tier.getMaxRequests());
    }
}
