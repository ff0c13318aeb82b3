package com.callplatform.guardsvc.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Locale;
import java.util.Set;

/**
 * Logback filter that drops log lines carrying CAPTCHA secrets, vendor tokens or bearer credentials.
 * Registered on the appenders in {@code logback-spring.xml}.
 */
public class SensitiveDataFilter extends Filter<ILoggingEvent> {

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
            "secret", "h-captcha-response", "captcharesponse", "authorization", "bearer "
    );

    @Override
    public FilterReply decide(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message != null && containsSensitiveField(message)) {
            return FilterReply.DENY;
        }
        return FilterReply.NEUTRAL;
    }

    public static boolean containsSensitiveField(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String field : SENSITIVE_FIELDS) {
            if (lower.contains(field)) {
                return true;
            }
        }
        return false;
    }
}
