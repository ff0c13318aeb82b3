package com.callplatform.guardsvc.domain.geo;

import com.callplatform.guardsvc.domain.model.ThreatLevel;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Pure rule evaluation. Rules are visited by descending priority (ties by id) and the first enabled
 * match decides: a block rule blocks, an allow rule exempts. No match allows.
 */
public final class GeoRuleEvaluator {

    private static final Comparator<GeoBlockRule> EVALUATION_ORDER = Comparator
            .comparingInt(GeoBlockRule::priority).reversed()
            .thenComparing(GeoBlockRule::id);

    private GeoRuleEvaluator() {
    }

    public static GeoBlockDecision evaluate(List<GeoBlockRule> rules, GeoLocation location) {
        if (rules == null || rules.isEmpty() || location == null) {
            return GeoBlockDecision.allow();
        }
        return rules.stream()
                .filter(GeoBlockRule::enabled)
                .sorted(EVALUATION_ORDER)
                .filter(rule -> matches(rule, location))
                .findFirst()
                .map(rule -> rule.type() == GeoRuleType.BLOCK
                        ? GeoBlockDecision.block(reason(rule, location), rule.id())
                        : GeoBlockDecision.allowedBy(rule.id()))
                .orElse(GeoBlockDecision.allow());
    }

    static boolean matches(GeoBlockRule rule, GeoLocation location) {
        if (!rule.countries().isEmpty()) {
            String code = upper(location.countryCode());
            String name = upper(location.country());
            if (!rule.countries().contains(code) && !rule.countries().contains(name)) {
                return false;
            }
        }
        ThreatLevel floor = rule.conditions().maxThreatLevel();
        return floor == null || location.threatLevel().isAtLeast(floor);
    }

    private static String reason(GeoBlockRule rule, GeoLocation location) {
        String where = location.country() != null ? location.country() : location.countryCode();
        return "Access from " + where + " is blocked (threat level " + location.threatLevel().code() + ")";
    }

    private static String upper(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}
