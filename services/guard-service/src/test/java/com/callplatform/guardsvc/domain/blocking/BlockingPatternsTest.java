package com.callplatform.guardsvc.domain.blocking;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class BlockingPatternsTest {

    @ParameterizedTest(name = "{0} {1} against {2} -> {3}")
    @CsvSource({
            "PHONE, +15551234567, +1555*, true",
            "PHONE, +14441234567, +1555*, false",
            "PHONE, +15551234567, +15551234567, true",
            "IP, 192.168.4.20, 192.168.*, true",
            "IP, 192.169.4.20, 192.168.*, false",
            "IP, 10.1.2.3, 10.*.2.*, true",
            "IP, 10.1.3.3, 10.*.2.*, false",
            "IP, 10.1.2.3, 10.1.2.3, true",
            "EMAIL, bot@spam.com, *@spam.com, true",
            "EMAIL, bot@notspam.org, *@spam.com, false",
            "EMAIL, someone@spam.com, someone@spam.com, true"
    })
    void matchesWildcards(BlockingRuleType type, String value, String pattern, boolean expected) {
        assertThat(BlockingPatterns.matches(type, value, pattern)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"PHONE", "IP", "EMAIL"})
    void nullsNeverMatch(BlockingRuleType type) {
        assertThat(BlockingPatterns.matches(type, null, "*")).isFalse();
        assertThat(BlockingPatterns.matches(type, "x", null)).isFalse();
    }
}
