package com.callplatform.guardsvc.domain.captcha;

import com.callplatform.guardsvc.config.GuardMetrics;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.behavior.BehaviorScore;
import com.callplatform.guardsvc.domain.model.UserContext;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitConfig;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitResult;
import com.callplatform.guardsvc.domain.ratelimit.RateLimitService;
import com.callplatform.guardsvc.infrastructure.captcha.CaptchaVendorException;
import com.callplatform.guardsvc.infrastructure.captcha.CaptchaVerifier;
import com.callplatform.guardsvc.infrastructure.captcha.VendorVerification;
import com.callplatform.guardsvc.infrastructure.logging.SecurityEventLogger;
import com.callplatform.guardsvc.infrastructure.store.CounterStore;
import com.callplatform.guardsvc.infrastructure.store.CounterStoreException;
import com.callplatform.guardsvc.shared.exception.InvalidRequestException;
import com.callplatform.guardsvc.shared.exception.RateLimitedException;
import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides when a caller must solve a CAPTCHA and runs the challenge lifecycle
 * (issued, then verified, expired or exhausted). Challenges live under {@code captcha:challenge:{id}}.
 * Verification fails closed: a vendor or store outage is a failed attempt.
 */
@Service
@Slf4j
public class CaptchaChallengeManager {

    static final String CHALLENGE_PREFIX = "captcha:challenge:";
    static final String VERIFIED_PREFIX = "captcha:verified:";
    static final String FAILURES_PREFIX = "captcha:failures:";
    static final String ISSUE_TIER = "captcha-issue";
    /** Expired challenges stay readable this long so a late attempt reports expiry, not absence. */
    private static final Duration EXPIRED_GRACE = Duration.ofMinutes(1);

    private final CounterStore counterStore;
    private final CaptchaVerifier verifier;
    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecurityUtils securityUtils;
    private final SecurityEventLogger securityEventLogger;
    private final GuardMetrics metrics;
    private final GuardProperties.Captcha settings;

    public CaptchaChallengeManager(CounterStore counterStore, CaptchaVerifier verifier,
                                   RateLimitService rateLimitService, ObjectMapper objectMapper, Clock clock,
                                   SecurityUtils securityUtils, SecurityEventLogger securityEventLogger,
                                   GuardMetrics metrics, GuardProperties properties) {
        this.counterStore = counterStore;
        this.verifier = verifier;
        this.rateLimitService = rateLimitService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.securityUtils = securityUtils;
        this.securityEventLogger = securityEventLogger;
        this.metrics = metrics;
        this.settings = properties.getCaptcha();
    }

    /**
     * A trusted role never needs a challenge, nor does a caller holding a recent verified pass.
     * Otherwise any one of: low behavior score, high request rate, suspicious IP, repeated failures.
     *
     * @param behaviorScore may be null
     * @param requestRate   requests in the caller's current window; may be null
     */
    public CaptchaDecision shouldRequireCaptcha(UserContext context, BehaviorScore behaviorScore, Integer requestRate) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        if (settings.getTrustedRoles().contains(context.role())) {
            return CaptchaDecision.notRequired("Trusted user role");
        }
        if (hasVerifiedPass(context.ipAddress())) {
            return CaptchaDecision.notRequired("Recently verified");
        }

        if (behaviorScore != null && behaviorScore.overallScore() < settings.getScoreThreshold()) {
            return CaptchaDecision.required(
                    "Low behavior score: " + behaviorScore.overallScore(),
                    Difficulty.forBehaviorScore(behaviorScore.overallScore()));
        }
        Difficulty base = behaviorScore != null
                ? Difficulty.forBehaviorScore(behaviorScore.overallScore())
                : Difficulty.EASY;
        if (requestRate != null && requestRate > settings.getRequestRateThreshold()) {
            return CaptchaDecision.required("High request rate: " + requestRate, base.atLeast(Difficulty.MEDIUM));
        }
        if (rateLimitService.isIPSuspicious(context.ipAddress(), context.country())) {
            return CaptchaDecision.required("Suspicious IP address", base.atLeast(Difficulty.MEDIUM));
        }
        long failures = recentFailures(context.ipAddress());
        if (failures >= settings.getFailureThreshold()) {
            return CaptchaDecision.required("Repeated CAPTCHA failures: " + failures, Difficulty.HARD);
        }
        return CaptchaDecision.notRequired("No risk signals");
    }

    public CaptchaDecision shouldRequireCaptcha(UserContext context) {
        return shouldRequireCaptcha(context, null, null);
    }

    /**
     * Forces a challenge for an external signal (geo threat, attack mode) unless the caller is
     * trusted or already holds a verified pass.
     */
    public CaptchaDecision escalate(UserContext context, String reason, Difficulty difficulty) {
        if (settings.getTrustedRoles().contains(context.role())) {
            return CaptchaDecision.notRequired("Trusted user role");
        }
        if (hasVerifiedPass(context.ipAddress())) {
            return CaptchaDecision.notRequired("Recently verified");
        }
        return CaptchaDecision.required(reason, difficulty != null ? difficulty : Difficulty.MEDIUM);
    }

    /**
     * Client-facing issuance. The caller may ask for a harder challenge than the risk signals
     * recommend, never an easier one, and each IP is held to the issue allowance.
     *
     * @param requested may be null to take the recommendation
     * @throws RateLimitedException when the IP has used up its issue allowance
     */
    public CaptchaChallenge issueChallenge(UserContext context, Difficulty requested) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        RateLimitConfig issueTier = RateLimitConfig.of(ISSUE_TIER, settings.getIssueWindow(), settings.getIssueLimit());
        RateLimitResult allowance = rateLimitService.checkLimit("ip:" + context.ipAddress(), issueTier, context);
        if (!allowance.allowed()) {
            long retryAfter = allowance.retryAfter() != null ? allowance.retryAfter() : issueTier.window().toSeconds();
            log.info("CAPTCHA issue allowance exhausted for {}", securityUtils.maskIp(context.ipAddress()));
            throw new RateLimitedException("Too many CAPTCHA challenges requested", Duration.ofSeconds(retryAfter));
        }
        return createChallenge(context, effectiveDifficulty(context, requested));
    }

    Difficulty effectiveDifficulty(UserContext context, Difficulty requested) {
        CaptchaDecision decision = shouldRequireCaptcha(context);
        if (requested == null) {
            return decision.difficulty() != null ? decision.difficulty() : Difficulty.MEDIUM;
        }
        return decision.difficulty() != null ? requested.atLeast(decision.difficulty()) : requested;
    }

    /**
     * Issues and stores a challenge bound to the caller's IP.
     *
     * @throws CounterStoreException if the challenge cannot be stored
     */
    public CaptchaChallenge createChallenge(UserContext context, Difficulty difficulty) {
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        long now = clock.millis();
        CaptchaChallenge challenge = new CaptchaChallenge(
                UUID.randomUUID().toString(),
                difficulty != null ? difficulty : Difficulty.MEDIUM,
                context.ipAddress(),
                now,
                now + settings.getChallengeTtl().toMillis(),
                0,
                settings.getMaxAttempts(),
                false);
        save(challenge, settings.getChallengeTtl().plus(EXPIRED_GRACE));
        log.debug("Issued {} CAPTCHA challenge {} to {}",
                challenge.difficulty().code(), challenge.id(), securityUtils.maskIp(context.ipAddress()));
        return challenge;
    }

    public Optional<CaptchaChallenge> getChallenge(String challengeId) {
        return load(challengeId);
    }

    public VerificationResult verifyChallenge(String challengeId, String response, UserContext context) {
        if (challengeId == null || challengeId.isBlank()) {
            throw new InvalidRequestException("challengeId", "Challenge id is required");
        }
        if (context == null) {
            throw new InvalidRequestException("context", "User context is required");
        }
        long now = clock.millis();

        Optional<CaptchaChallenge> loaded;
        try {
            loaded = load(challengeId);
        } catch (CounterStoreException e) {
            log.warn("CAPTCHA challenge store unavailable: {}", e.getMessage());
            metrics.captchaVerification("unavailable");
            return VerificationResult.failed(VerificationResult.UNAVAILABLE, null, null);
        }
        if (loaded.isEmpty()) {
            metrics.captchaVerification("not_found");
            return VerificationResult.failed(VerificationResult.NOT_FOUND, null, null);
        }

        CaptchaChallenge challenge = loaded.get();
        switch (challenge.state(now)) {
            case EXPIRED -> {
                deleteQuietly(challengeId);
                metrics.captchaVerification("expired");
                return VerificationResult.failed(VerificationResult.EXPIRED, ChallengeState.EXPIRED, 0);
            }
            case EXHAUSTED -> {
                metrics.captchaVerification("exhausted");
                return VerificationResult.failed(VerificationResult.EXHAUSTED, ChallengeState.EXHAUSTED, 0);
            }
            case VERIFIED -> {
                return VerificationResult.failed(VerificationResult.NOT_FOUND, ChallengeState.VERIFIED, null);
            }
            default -> {
                // ISSUED: fall through to the attempt
            }
        }

        if (!challenge.ipAddress().equals(context.ipAddress())) {
            return recordFailure(challenge, context, VerificationResult.WRONG_CLIENT, now);
        }
        if (response == null || response.isBlank()) {
            return recordFailure(challenge, context, "CAPTCHA verification failed: missing-input-response", now);
        }

        VendorVerification verification;
        try {
            verification = verifier.verify(response, context.ipAddress());
        } catch (CaptchaVendorException e) {
            log.warn("CAPTCHA vendor unavailable, counting attempt as failed: {}", e.getMessage());
            return recordFailure(challenge, context, VerificationResult.UNAVAILABLE, now);
        }

        if (!verification.success()) {
            String codes = verification.errorCodes().isEmpty()
                    ? "rejected"
                    : String.join(", ", verification.errorCodes());
            return recordFailure(challenge, context, "CAPTCHA verification failed: " + codes, now);
        }

        deleteQuietly(challengeId);
        grantVerifiedPass(context.ipAddress());
        metrics.captchaVerification("success");
        log.debug("CAPTCHA challenge {} verified", challengeId);
        return VerificationResult.verified();
    }

    public String captchaType() {
        return verifier.captchaType();
    }

    private VerificationResult recordFailure(CaptchaChallenge challenge, UserContext context, String error, long now) {
        CaptchaChallenge updated = challenge.withFailedAttempt();
        Duration remainingTtl = Duration.ofMillis(Math.max(1, updated.expiry() - now)).plus(EXPIRED_GRACE);
        try {
            save(updated, remainingTtl);
            counterStore.addScored(FAILURES_PREFIX + context.ipAddress(), now,
                    challenge.id() + ":" + updated.attempts(), settings.getFailureWindow());
        } catch (CounterStoreException e) {
            log.warn("Could not persist CAPTCHA failure for {}: {}", challenge.id(), e.getMessage());
        }

        ChallengeState state = updated.state(now);
        if (state == ChallengeState.EXHAUSTED) {
            metrics.captchaVerification("exhausted");
            securityEventLogger.log(SecurityEventLogger.CAPTCHA_EXHAUSTED, context.ipAddress(), null,
                    "CAPTCHA challenge exhausted", Map.of("challengeId", challenge.id(),
                            "attempts", String.valueOf(updated.attempts())));
        } else {
            metrics.captchaVerification("failure");
            securityEventLogger.log(SecurityEventLogger.CAPTCHA_FAILED, context.ipAddress(), null,
                    "CAPTCHA verification failed", Map.of("challengeId", challenge.id(),
                            "attempts", String.valueOf(updated.attempts())));
        }
        return VerificationResult.failed(error, state, updated.remainingAttempts());
    }

    private boolean hasVerifiedPass(String ipAddress) {
        try {
            return counterStore.exists(VERIFIED_PREFIX + ipAddress);
        } catch (CounterStoreException e) {
            log.debug("Verified-pass lookup failed: {}", e.getMessage());
            return false;
        }
    }

    private void grantVerifiedPass(String ipAddress) {
        try {
            counterStore.set(VERIFIED_PREFIX + ipAddress, String.valueOf(clock.millis()), settings.getVerifiedPassTtl());
        } catch (CounterStoreException e) {
            log.warn("Could not grant verified pass to {}: {}", securityUtils.maskIp(ipAddress), e.getMessage());
        }
    }

    private long recentFailures(String ipAddress) {
        long now = clock.millis();
        try {
            return counterStore.countByScore(FAILURES_PREFIX + ipAddress,
                    now - settings.getFailureWindow().toMillis(), now);
        } catch (CounterStoreException e) {
            log.debug("CAPTCHA failure count unavailable: {}", e.getMessage());
            return 0L;
        }
    }

    private Optional<CaptchaChallenge> load(String challengeId) {
        Optional<String> json = counterStore.get(CHALLENGE_PREFIX + challengeId);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), CaptchaChallenge.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed CAPTCHA challenge {}", challengeId);
            return Optional.empty();
        }
    }

    private void save(CaptchaChallenge challenge, Duration ttl) {
        try {
            counterStore.set(CHALLENGE_PREFIX + challenge.id(), objectMapper.writeValueAsString(challenge), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("CAPTCHA challenge is not serializable", e);
        }
    }

    private void deleteQuietly(String challengeId) {
        try {
            counterStore.delete(CHALLENGE_PREFIX + challengeId);
        } catch (CounterStoreException e) {
            log.debug("Could not delete CAPTCHA challenge {}: {}", challengeId, e.getMessage());
        }
    }
}
