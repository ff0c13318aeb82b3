package com.callplatform.guardsvc.infrastructure.logging;

import com.callplatform.guardsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes security events as structured JSON lines tagged {@code [SECURITY]}, off the request thread.
 * IPs and identifiers are masked before they leave this class.
 */
@Component
public class SecurityEventLogger {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventLogger.class);
    private static final String SERVICE_ID = "guard-service";

    public static final String GEO_BLOCKED = "GEO_BLOCKED";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String BYPASS_DETECTED = "BYPASS_DETECTED";
    public static final String SUSPICIOUS_BEHAVIOR = "SUSPICIOUS_BEHAVIOR";
    public static final String CAPTCHA_FAILED = "CAPTCHA_FAILED";
    public static final String CAPTCHA_EXHAUSTED = "CAPTCHA_EXHAUSTED";
    public static final String BLOCKING_RULE_HIT = "BLOCKING_RULE_HIT";
    public static final String DDOS_DETECTED = "DDOS_DETECTED";

    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    public SecurityEventLogger(SecurityUtils securityUtils, ObjectMapper objectMapper) {
        this.securityUtils = securityUtils;
        this.objectMapper = objectMapper;
    }

    /**
     * Captures the current correlation id and logs the event asynchronously.
     */
    public CompletableFuture<Void> log(String eventType, String ipAddress, String identifier,
                                       String description, Map<String, String> metadata) {
        return logSecurity(SecurityEvent.of(eventType, ipAddress, identifier,
                securityUtils.getCurrentCorrelationId(), description, metadata));
    }

    public CompletableFuture<Void> logSecurity(SecurityEvent event) {
        return CompletableFuture.runAsync(() -> write(event));
    }

    private void write(SecurityEvent event) {
        try {
            Map<String, Object> logEntry = new LinkedHashMap<>();
            logEntry.put("level", "SECURITY");
            logEntry.put("eventType", event.eventType());
            logEntry.put("description", event.description());
            logEntry.put("serviceId", SERVICE_ID);
            logEntry.put("correlationId", event.correlationId());
            logEntry.put("maskedIp", securityUtils.maskIp(event.ipAddress()));
            if (event.identifier() != null) {
                logEntry.put("identifier", securityUtils.maskIdentifier(event.identifier()));
            }
            if (!event.metadata().isEmpty()) {
                logEntry.put("metadata", event.metadata());
            }
            logEntry.put("timestamp", event.timestamp().toString());

            log.warn("[SECURITY] {}", objectMapper.writeValueAsString(logEntry));
        } catch (JsonProcessingException e) {
            log.error("Failed to write security event {}: {}", event.eventType(), e.getMessage());
        }
    }
}
