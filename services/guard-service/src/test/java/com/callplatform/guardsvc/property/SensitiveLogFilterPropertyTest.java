package com.callplatform.guardsvc.property;

import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.spi.FilterReply;
import com.callplatform.guardsvc.config.SensitiveDataFilter;
import net.jqwik.api.*;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property 11: Secret Non-Exposure in Logs
 * Validates: log filtering of CAPTCHA secrets, vendor tokens and bearer credentials
 */
class SensitiveLogFilterPropertyTest {

    private final SensitiveDataFilter filter = new SensitiveDataFilter();

    @Property(tries = 100)
    void linesWithSecretsAreDropped(
            @ForAll("plainText") String prefix,
            @ForAll("markers") String marker,
            @ForAll("plainText") String suffix) {

        assertThat(filter.decide(event(prefix + marker + suffix))).isEqualTo(FilterReply.DENY);
    }

    @Property(tries = 100)
    void ordinaryLinesPassThrough(@ForAll("plainText") String message) {
        assertThat(filter.decide(event("Rate limit exceeded: tier=anonymous " + message)))
                .isEqualTo(FilterReply.NEUTRAL);
    }

    @Provide
    Arbitrary<String> markers() {
        return Arbitraries.of("secret=", "H-Captcha-Response", "captchaResponse", "Authorization:", "Bearer ");
    }

    @Provide
    Arbitrary<String> plainText() {
        return Arbitraries.strings().numeric().withChars(' ', '=', ':').ofMaxLength(30);
    }

    private static LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setMessage(message);
        return event;
    }
}
