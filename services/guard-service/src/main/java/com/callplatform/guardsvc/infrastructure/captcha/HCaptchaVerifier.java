package com.callplatform.guardsvc.infrastructure.captcha;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * hCaptcha {@code siteverify} client behind a circuit breaker. The secret never reaches a log line.
 */
@Component
public class HCaptchaVerifier implements CaptchaVerifier {

    private static final Logger log = LoggerFactory.getLogger(HCaptchaVerifier.class);

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String verifyUrl;
    private final String secret;
    private final String siteKey;

    public HCaptchaVerifier(
            RestTemplate guardRestTemplate,
            CircuitBreakerRegistry circuitBreakerRegistry,
            @Value("${app.platform.captcha.verify-url:https://hcaptcha.com/siteverify}") String verifyUrl,
            @Value("${app.platform.captcha.secret:}") String secret,
            @Value("${app.guard.captcha.site-key:}") String siteKey) {
        this.restTemplate = guardRestTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("captchaVendor");
        this.verifyUrl = verifyUrl;
        this.secret = secret;
        this.siteKey = siteKey;
    }

    @Override
    public VendorVerification verify(String response, String remoteIp) {
        if (secret.isBlank()) {
            throw new CaptchaVendorException("CAPTCHA vendor credentials are not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("secret", secret);
        form.add("response", response);
        if (remoteIp != null) {
            form.add("remoteip", remoteIp);
        }
        if (!siteKey.isBlank()) {
            form.add("sitekey", siteKey);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            JsonNode body = circuitBreaker.executeSupplier(
                    () -> restTemplate.postForObject(verifyUrl, new HttpEntity<>(form, headers), JsonNode.class));
            if (body == null) {
                throw new CaptchaVendorException("Empty CAPTCHA vendor response");
            }
            return parse(body);
        } catch (CallNotPermittedException e) {
            throw new CaptchaVendorException("CAPTCHA vendor circuit open", e);
        } catch (RestClientException e) {
            log.warn("CAPTCHA vendor call failed: {}", e.getClass().getSimpleName());
            throw new CaptchaVendorException("CAPTCHA vendor call failed", e);
        }
    }

    @Override
    public String captchaType() {
        return "hcaptcha";
    }

    static VendorVerification parse(JsonNode body) {
        List<String> errorCodes = new ArrayList<>();
        body.path("error-codes").forEach(code -> errorCodes.add(code.asText()));
        return new VendorVerification(body.path("success").asBoolean(false), errorCodes);
    }
}
