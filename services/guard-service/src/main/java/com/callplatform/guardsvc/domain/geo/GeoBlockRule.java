package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A geographic rule. An empty country set matches every country; a null
 * {@code maxThreatLevel} matches every threat level.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeoBlockRule(
        String id,
        GeoRuleType type,
        Set<String> countries,
        Conditions conditions,
        int priority,
        boolean enabled
) {
    public GeoBlockRule {
        if (id == null || id.isBlank()) {
            throw new InvalidRequestException("id", "Geo rule id is required");
        }
        if (type == null) {
            throw new InvalidRequestException("type", "Geo rule type is required");
        }
        countries = countries == null ? Set.of() : countries.stream()
                .map(country -> country.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (conditions == null) {
            conditions = new Conditions(null);
        }
    }

    public static GeoBlockRule block(String id, Set<String> countries, ThreatLevel maxThreatLevel, int priority) {
        return new GeoBlockRule(id, GeoRuleType.BLOCK, countries, new Conditions(maxThreatLevel), priority, true);
    }

    public static GeoBlockRule allow(String id, Set<String> countries, int priority) {
        return new GeoBlockRule(id, GeoRuleType.ALLOW, countries, new Conditions(null), priority, true);
    }

    /**
     * Threat floor: the rule only matches locations at or above {@code maxThreatLevel}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Conditions(ThreatLevel maxThreatLevel) {
    }
}
