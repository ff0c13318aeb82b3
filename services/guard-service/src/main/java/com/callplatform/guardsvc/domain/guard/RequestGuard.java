package com.callplatform.guardsvc.domain.guard;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.behavior.BehaviorPattern;
import com.callplatform.guardsvc.domain.behavior.BehaviorScore;
import com.callplatform.guardsvc.domain.behavior.BehavioralAnalyzer;
import com.callplatform.guardsvc.domain.blocking.BlockingRule;
import com.callplatform.guardsvc.domain.blocking.BlockingRuleService;
import com.callplatform.guardsvc.domain.blocking.BlockingRuleType;
import com.callplatform.guardsvc.domain.bypass.BypassAnalysis;
import com.callplatform.guardsvc.domain.bypass.BypassDetector;
import com.callplatform.guardsvc.domain.captcha.CaptchaChallengeManager;
import com.callplatform.guardsvc.domain.captcha.CaptchaDecision;
import com.callplatform.guardsvc.domain.captcha.Difficulty;
import com.callplatform.guardsvc.domain.ddos.DdosAssessment;
import com.callplatform.guardsvc.domain.ddos.DdosMonitor;
import com.callplatform.guardsvc.domain.ddos.MitigationAction;
import com.callplatform.guardsvc.domain.geo.GeoBlockDecision;
import com.callplatform.guardsvc.domain.geo.GeoIpAnalyzer;
import com.callplatform.guardsvc.domain.geo.GeoLocation;
import com.callplatform.guardsvc.domain.model.ThreatLevel;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.model.UserRole;
import com.callplatform.guardsvc.domain.ratelimit.IdentifierResolver;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitConfig;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitResult;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitService;
import com.callplatform.guardsvc.infrastructure.logging.SecurityEventLogger;
import com.callplatform.guardsvc.shared.exception.GuardServiceException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the per-request protection pipeline: skip rules, geo blocking, blocking rules, DDoS mitigation,
 * bypass detection, rate limiting, then the CAPTCHA decision on denial.
 * Any unexpected failure lets the request through.
 */
@Service
@Slf4j
public class RequestGuard {

    static final long EMERGENCY_RETRY_AFTER_SECONDS = 300;
    static final double STRICT_LIMIT_PENALTY = 2.0;
    static final double ENHANCED_LIMIT_PENALTY = 1.5;

    private final GeoIpAnalyzer geoIpAnalyzer;
    private final BlockingRuleService blockingRuleService;
    private final DdosMonitor ddosMonitor;
    private final BypassDetector bypassDetector;
    private final RateLimitService rateLimitService;
    private final CaptchaChallengeManager captchaManager;
    private final BehavioralAnalyzer behavioralAnalyzer;
    private final IdentifierResolver identifierResolver;
    private final SecurityEventLogger securityEventLogger;
    private final SecurityUtils securityUtils;
    private final GuardMetrics metrics;
    private final Clock clock;
    private final GuardProperties.Orchestration settings;
    private final int autoBlockThreshold;

    public RequestGuard(GeoIpAnalyzer geoIpAnalyzer, BlockingRuleService blockingRuleService, DdosMonitor ddosMonitor,
                        BypassDetector bypassDetector, RateLimitService rateLimitService,
                        CaptchaChallengeManager captchaManager, BehavioralAnalyzer behavioralAnalyzer,
                        IdentifierResolver identifierResolver, SecurityEventLogger securityEventLogger,
                        SecurityUtils securityUtils, GuardMetrics metrics, Clock clock, GuardProperties properties) {
        this.geoIpAnalyzer = geoIpAnalyzer;
        this.blockingRuleService = blockingRuleService;
        this.ddosMonitor = ddosMonitor;
        this.bypassDetector = bypassDetector;
        this.rateLimitService = rateLimitService;
        this.captchaManager = captchaManager;
        this.behavioralAnalyzer = behavioralAnalyzer;
        this.identifierResolver = identifierResolver;
        this.securityEventLogger = securityEventLogger;
        this.securityUtils = securityUtils;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = properties.getOrchestration();
        this.autoBlockThreshold = properties.getBlocking().getAutoBlockThreshold();
    }

    /**
     * Evaluates one request.
     *
     * @throws InvalidRequestException only in strict-input mode, for a malformed request
     */
    public GuardDecision evaluate(GuardRequest request) {
        if (request == null || request.context() == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        if (shouldSkip(request)) {
            return GuardDecision.SKIP;
        }

        GuardDecision decision;
        try {
            decision = runPipeline(request);
        } catch (GuardServiceException e) {
            if (settings.isStrictInput()) {
                throw e;
            }
            log.warn("Guard pipeline rejected input, failing open: {}", e.getMessage());
            metrics.failOpen("orchestration");
            decision = GuardDecision.failOpen(null);
        } catch (RuntimeException e) {
            log.error("Guard pipeline failed, failing open: path={}, ip={}",
                    request.path(), securityUtils.maskIp(request.context().ipAddress()), e);
            metrics.failOpen("orchestration");
            decision = GuardDecision.failOpen(null);
        }
        metrics.decision(decision.outcome().code());
        return decision;
    }

    /**
     * Feeds the finished request into behavioral analysis. Never throws.
     */
    public void recordOutcome(GuardRequest request, GuardDecision decision, int responseStatus, long responseTimeMs) {
        if (!settings.isBehavioralAnalysisEnabled() || request == null || request.context() == null
                || (decision != null && decision.outcome() == GuardOutcome.SKIPPED)) {
            return;
        }
        try {
            BehaviorPattern event = new BehaviorPattern(request.context().ipAddress(), clock.millis(),
                    request.path(), request.method(), responseStatus, Math.max(0, responseTimeMs));
            behavioralAnalyzer.recordPattern(event, request.context());
        } catch (RuntimeException e) {
            log.warn("Could not record behavior for {}: {}",
                    securityUtils.maskIp(request.context().ipAddress()), e.getMessage());
        }
    }

    boolean shouldSkip(GuardRequest request) {
        String method = request.method().toUpperCase(Locale.ROOT);
        if (settings.getSkipMethods().stream().anyMatch(m -> m.equalsIgnoreCase(method))) {
            return true;
        }
        String path = request.path();
        return settings.getSkipPaths().stream()
                .anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }

    private GuardDecision runPipeline(GuardRequest request) {
        UserContext context = request.context();
        String ip = context.ipAddress();

        GeoLocation location = null;
        if (settings.isGeoBlockingEnabled()) {
            GeoBlockDecision geo = geoIpAnalyzer.shouldBlockIP(ip);
            if (geo.blocked()) {
                securityEventLogger.log(SecurityEventLogger.GEO_BLOCKED, ip, null, geo.reason(),
                        geo.ruleId() != null ? Map.of("ruleId", geo.ruleId()) : Map.of());
                return GuardDecision.builder()
                        .outcome(GuardOutcome.GEO_BLOCKED)
                        .reason(geo.reason())
                        .ruleId(geo.ruleId())
                        .build();
            }
            location = geoIpAnalyzer.analyzeIP(ip);
            if (location.isResolved()) {
                context = context.withLocation(location.countryCode(), location.city());
            }
            autoBlockIfCritical(ip, location);
        }

        var rule = blockingRuleService.checkBlocked(BlockingRuleType.IP, ip);
        if (rule.isPresent()) {
            return ruleBlocked(ip, rule.get());
        }

        // anonymous callers are told to authenticate; everyone but admins is shed in emergency mode
        DdosAssessment ddos = ddosMonitor.recordAndAssess(ip);
        if (ddos.requires(MitigationAction.BLOCK_ALL_ANONYMOUS) && !context.authenticated()) {
            return GuardDecision.builder()
                    .outcome(GuardOutcome.AUTHENTICATION_REQUIRED)
                    .reason("Authentication required")
                    .retryAfter(EMERGENCY_RETRY_AFTER_SECONDS)
                    .build();
        }
        if (ddos.requires(MitigationAction.ACTIVATE_EMERGENCY_MODE) && context.role() != UserRole.ADMIN) {
            return GuardDecision.builder()
                    .outcome(GuardOutcome.EMERGENCY_MODE)
                    .reason("Service temporarily unavailable")
                    .retryAfter(EMERGENCY_RETRY_AFTER_SECONDS)
                    .build();
        }

        String identifier = identifierResolver.resolve(context);

        BypassAnalysis bypass = BypassAnalysis.NONE;
        if (settings.isBypassProtectionEnabled()) {
            bypass = bypassDetector.analyzeRequest(context, request.headers());
        }

        RateLimitConfig config = rateLimitService.getUserRateLimit(context, request.path())
                .withPenalty(bypass.penaltyMultiplier());
        if (ddos.requires(MitigationAction.STRICT_RATE_LIMITS)) {
            config = config.withPenalty(STRICT_LIMIT_PENALTY);
        } else if (ddos.requires(MitigationAction.ENHANCED_RATE_LIMITS)) {
            config = config.withPenalty(ENHANCED_LIMIT_PENALTY);
        }

        RateLimitResult result = rateLimitService.checkLimit(identifier, config, context);
        if (result.allowed()) {
            return GuardDecision.builder()
                    .outcome(GuardOutcome.ALLOWED)
                    .identifier(identifier)
                    .rateLimit(result)
                    .bypass(bypass)
                    .degraded(result.degraded())
                    .build();
        }

        if (bypass.attemptId() != null) {
            bypassDetector.recordMitigation(bypass.attemptId());
        }
        CaptchaDecision captcha = captchaDecision(context, identifier, result, location, ddos);
        securityEventLogger.log(SecurityEventLogger.RATE_LIMITED, ip, identifier,
                "Rate limit exceeded for tier " + config.name(),
                Map.of("tier", config.name(),
                        "limit", String.valueOf(config.maxRequests()),
                        "captchaRequired", String.valueOf(captcha.required())));

        return GuardDecision.builder()
                .outcome(captcha.required() ? GuardOutcome.CAPTCHA_REQUIRED : GuardOutcome.RATE_LIMITED)
                .identifier(identifier)
                .reason(captcha.required() ? captcha.reason() : "Rate limit exceeded")
                .retryAfter(result.retryAfter())
                .rateLimit(result)
                .captcha(captcha)
                .bypass(bypass)
                .build();
    }

    private CaptchaDecision captchaDecision(UserContext context, String identifier, RateLimitResult result,
                                            GeoLocation location, DdosAssessment ddos) {
        BehaviorScore score = settings.isBehavioralAnalysisEnabled()
                ? behavioralAnalyzer.getBehaviorScore(identifier)
                : null;
        CaptchaDecision decision = captchaManager.shouldRequireCaptcha(context, score, result.totalRequests());
        if (decision.required()) {
            return decision;
        }
        if (ddos.requires(MitigationAction.ENABLE_STRICT_CAPTCHA)) {
            return captchaManager.escalate(context, "Platform under attack", Difficulty.HARD);
        }
        if (ddos.requires(MitigationAction.ENABLE_CAPTCHA)) {
            return captchaManager.escalate(context, "Platform under elevated load", Difficulty.MEDIUM);
        }
        if (location != null && location.threatLevel().isAtLeast(ThreatLevel.HIGH)) {
            return captchaManager.escalate(context,
                    "High threat location: " + location.threatLevel().code(), Difficulty.HARD);
        }
        if (result.totalRequests() > settings.getCaptchaTotalRequestsThreshold()) {
            return captchaManager.escalate(context,
                    "Excessive requests: " + result.totalRequests(), Difficulty.MEDIUM);
        }
        return decision;
    }

    private void autoBlockIfCritical(String ip, GeoLocation location) {
        int risk = 100 - location.reputation();
        if (location.isResolved() && risk >= autoBlockThreshold) {
            blockingRuleService.autoBlock(BlockingRuleType.IP, ip,
                    "Critical IP reputation: risk " + risk + " (" + location.countryCode() + ")");
        }
    }

    private GuardDecision ruleBlocked(String ip, BlockingRule rule) {
        securityEventLogger.log(SecurityEventLogger.BLOCKING_RULE_HIT, ip, null, rule.reason(),
                Map.of("ruleId", rule.id(), "type", rule.type().code()));
        return GuardDecision.builder()
                .outcome(GuardOutcome.RULE_BLOCKED)
                .reason(rule.reason() != null ? rule.reason() : "Access blocked")
                .ruleId(rule.id())
                .build();
    }
}
