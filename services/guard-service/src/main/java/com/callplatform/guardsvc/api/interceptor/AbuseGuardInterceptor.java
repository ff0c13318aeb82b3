package com.callplatform.guardsvc.api.interceptor;

import com.callplatform.guardsvc.api.error.GlobalExceptionHandler;
import com.callplatform.guardsvc.api.error.ProblemDetail;
import com.callplatform.guardsvc.domain.captcha.CaptchaChallengeManager;
import com.callplatform.guardsvc.domain.guard.GuardDecision;
import com.callplatform.guardsvc.domain.guard.GuardOutcome;
import com.callplatform.guardsvc.domain.guard.GuardRequest;
import com.callplatform.guardsvc.domain.guard.RequestGuard;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitResult;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the guard pipeline before every handler, writes rate-limit headers and renders denials
 * as Problem Detail bodies. Behavior is recorded once the response is complete.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AbuseGuardInterceptor implements HandlerInterceptor {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "X-RateLimit-RetryAfter";
    public static final String RETRY_AFTER = "Retry-After";

    static final String REQUEST_ATTRIBUTE = AbuseGuardInterceptor.class.getName() + ".request";
    static final String DECISION_ATTRIBUTE = AbuseGuardInterceptor.class.getName() + ".decision";
    static final String STARTED_ATTRIBUTE = AbuseGuardInterceptor.class.getName() + ".started";

    private final RequestGuard requestGuard;
    private final UserContextResolver contextResolver;
    private final CaptchaChallengeManager captchaManager;
    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        GuardRequest guardRequest = new GuardRequest(
                request.getMethod(),
                pathWithinApplication(request),
                contextResolver.resolve(request),
                contextResolver.headers(request));

        GuardDecision decision = requestGuard.evaluate(guardRequest);
        request.setAttribute(REQUEST_ATTRIBUTE, guardRequest);
        request.setAttribute(DECISION_ATTRIBUTE, decision);
        request.setAttribute(STARTED_ATTRIBUTE, System.nanoTime());

        if (decision.rateLimit() != null) {
            writeRateLimitHeaders(response, decision.rateLimit());
        }
        if (decision.permitted()) {
            return true;
        }

        log.debug("Request denied: outcome={}, path={}", decision.outcome().code(), guardRequest.path());
        writeDenial(request, response, decision);
        return false;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        Object guardRequest = request.getAttribute(REQUEST_ATTRIBUTE);
        Object decision = request.getAttribute(DECISION_ATTRIBUTE);
        Object started = request.getAttribute(STARTED_ATTRIBUTE);
        if (!(guardRequest instanceof GuardRequest recorded)) {
            return;
        }
        long elapsedMs = started instanceof Long nanos ? (System.nanoTime() - nanos) / 1_000_000 : 0L;
        requestGuard.recordOutcome(recorded, decision instanceof GuardDecision d ? d : null,
                response.getStatus(), elapsedMs);
    }

    static void writeRateLimitHeaders(HttpServletResponse response, RateLimitResult result) {
        response.setHeader(HEADER_LIMIT, String.valueOf(result.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(result.remaining()));
        response.setHeader(HEADER_RESET, String.valueOf((result.resetTime() + 999) / 1000));
        if (!result.allowed() && result.retryAfter() != null) {
            response.setHeader(HEADER_RETRY_AFTER, String.valueOf(result.retryAfter()));
        }
    }

    private void writeDenial(HttpServletRequest request, HttpServletResponse response, GuardDecision decision)
            throws IOException {
        GuardOutcome outcome = decision.outcome();
        Map<String, Object> extensions = new LinkedHashMap<>();
        String type;
        String title;
        String detail;

        switch (outcome) {
            case GEO_BLOCKED, RULE_BLOCKED -> {
                type = outcome == GuardOutcome.GEO_BLOCKED ? "geo-blocked" : "access-blocked";
                title = "Access Denied";
                detail = decision.reason();
                extensions.put("reason", decision.reason());
                extensions.put("ruleId", decision.ruleId());
            }
            case EMERGENCY_MODE -> {
                type = "service-unavailable";
                title = "Service Unavailable";
                detail = decision.reason();
                extensions.put("retryAfter", decision.retryAfter());
            }
            default -> {
                boolean captchaRequired = outcome == GuardOutcome.CAPTCHA_REQUIRED;
                type = "rate-limited";
                title = "Rate Limit Exceeded";
                detail = outcome == GuardOutcome.AUTHENTICATION_REQUIRED
                        ? decision.reason()
                        : "Too many requests. Please try again later.";
                extensions.put("reason", decision.reason());
                extensions.put("retryAfter", decision.retryAfter());
                extensions.put("requiresCaptcha", captchaRequired);
                if (captchaRequired) {
                    extensions.put("captchaType", captchaManager.captchaType());
                    if (decision.captcha() != null && decision.captcha().difficulty() != null) {
                        extensions.put("difficulty", decision.captcha().difficulty().code());
                    }
                }
            }
        }
        extensions.values().removeIf(value -> value == null);

        if (decision.retryAfter() != null) {
            response.setHeader(RETRY_AFTER, String.valueOf(decision.retryAfter()));
        }

        ProblemDetail problem = ProblemDetail.of(
                GlobalExceptionHandler.PROBLEM_TYPE_BASE + type,
                title,
                outcome.httpStatus(),
                detail,
                request.getRequestURI(),
                securityUtils.getCurrentCorrelationId(),
                outcome.name(),
                extensions);

        response.setStatus(outcome.httpStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
