package com.callplatform.guardsvc.domain.blocking;

/**
 * Wildcard matching for {@link BlockingRuleType#PATTERN} rules: phone prefixes ({@code +1555*}),
 * IP octet wildcards ({@code 192.168.*}) and email domains ({@code *@spam.com}). Anything else must match exactly.
 */
final class BlockingPatterns {

    private BlockingPatterns() {
    }

    static boolean matches(BlockingRuleType valueType, String value, String pattern) {
        if (value == null || pattern == null) {
            return false;
        }
        switch (valueType) {
            case PHONE -> {
                if (pattern.endsWith("*")) {
                    return value.startsWith(pattern.substring(0, pattern.length() - 1));
                }
            }
            case IP -> {
                if (pattern.contains("*")) {
                    String[] parts = pattern.split("\\.");
                    String[] valueParts = value.split("\\.");
                    for (int i = 0; i < parts.length; i++) {
                        if (!"*".equals(parts[i]) && (i >= valueParts.length || !parts[i].equals(valueParts[i]))) {
                            return false;
                        }
                    }
                    return true;
                }
            }
            case EMAIL -> {
                if (pattern.startsWith("*@")) {
                    return value.endsWith(pattern.substring(1));
                }
            }
            default -> {
                // patterns only apply to concrete value types
            }
        }
        return value.equals(pattern);
    }
}
