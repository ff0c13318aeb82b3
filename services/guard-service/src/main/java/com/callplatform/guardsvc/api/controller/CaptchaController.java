package com.callplatform.guardsvc.api.controller;

import com.callplatform.guardsvc.api.dto.request.CaptchaChallengeRequest;
import com.callplatform.guardsvc.api.dto.request.CaptchaVerifyRequest;
import com.callplatform.guardsvc.api.dto.response.CaptchaChallengeResponse;
import com.callplatform.guardsvc.api.interceptor.UserContextResolver;
import com.callplatform.guardsvc.config.GuardProperties;
import com.callplatform.guardsvc.domain.captcha.CaptchaChallenge;
import com.callplatform.guardsvc.domain.captcha.CaptchaChallengeManager;
import com.callplatform.guardsvc.domain.captcha.Difficulty;
import com.callplatform.guardsvc.domain.captcha.VerificationResult;
import com.callplatform.guardsvc.domain.model.UserContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/captcha")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "CAPTCHA", description = "Challenge issue and verification")
public class CaptchaController {

    private final CaptchaChallengeManager captchaManager;
    private final UserContextResolver contextResolver;
    private final GuardProperties properties;

    @PostMapping("/challenge")
    @Operation(summary = "Issue challenge", description = "Issues a challenge bound to the caller's IP, never easier than recommended")
    @ApiResponse(responseCode = "201", description = "Challenge issued")
    @ApiResponse(responseCode = "429", description = "Issue allowance exhausted")
    public ResponseEntity<CaptchaChallengeResponse> issue(
            @Valid @RequestBody(required = false) CaptchaChallengeRequest request,
            HttpServletRequest httpRequest) {

        UserContext context = contextResolver.resolve(httpRequest);
        Difficulty requested = request != null && request.difficulty() != null
                ? Difficulty.fromCode(request.difficulty())
                : null;

        CaptchaChallenge challenge = captchaManager.issueChallenge(context, requested);
        return ResponseEntity.status(HttpStatus.CREATED).body(new CaptchaChallengeResponse(
                challenge.id(),
                challenge.difficulty().code(),
                captchaManager.captchaType(),
                properties.getCaptcha().getSiteKey(),
                Instant.ofEpochMilli(challenge.expiry()),
                challenge.maxAttempts()));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify challenge", description = "Checks the solved token with the CAPTCHA vendor")
    @ApiResponse(responseCode = "200", description = "Challenge verified")
    @ApiResponse(responseCode = "400", description = "Verification failed")
    public ResponseEntity<VerificationResult> verify(
            @Valid @RequestBody CaptchaVerifyRequest request,
            HttpServletRequest httpRequest) {

        UserContext context = contextResolver.resolve(httpRequest);
        VerificationResult result = captchaManager.verifyChallenge(request.challengeId(), request.response(), context);
        if (result.success()) {
            log.info("CAPTCHA challenge verified");
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.badRequest().body(result);
    }
}
