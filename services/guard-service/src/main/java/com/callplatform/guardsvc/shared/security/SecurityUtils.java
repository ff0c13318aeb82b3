package com.callplatform.guardsvc.shared.security;

import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Centralized helpers for IP masking, fingerprinting and MDC correlation.
 */
@Component
public class SecurityUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String CLIENT_IP_KEY = "clientIp";
    private static final Pattern IPV4_PATTERN = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\\.\\d{1,3}$");

    /**
     * Masks an IPv4 address by replacing the last octet with ***.
     * Example: 192.168.1.100 -> 192.168.1.***
     */
    public String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "***";
        }
        var matcher = IPV4_PATTERN.matcher(ip.trim());
        if (matcher.matches()) {
            return matcher.group(1) + ".***";
        }
        // IPv6 or garbage: keep only a short prefix
        return ip.length() > 6 ? ip.substring(0, 6) + "***" : "***";
    }

    /**
     * Masks an identifier of the form {@code kind:value}, keeping the kind.
     */
    public String maskIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "***";
        }
        int colon = identifier.indexOf(':');
        if (colon < 0) {
            return maskIp(identifier);
        }
        String kind = identifier.substring(0, colon);
        String value = identifier.substring(colon + 1);
        if ("ip".equals(kind)) {
            return kind + ":" + maskIp(value);
        }
        return kind + ":" + (value.length() > 4 ? value.substring(0, 4) + "***" : "***");
    }

    /**
     * Short stable SHA-256 fingerprint, used to track user agents without storing them verbatim.
     */
    public String fingerprint(String value) {
        if (value == null) {
            return "none";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && !provided.isBlank()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String clientIp) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (clientIp != null) {
            MDC.put(CLIENT_IP_KEY, maskIp(clientIp));
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(CLIENT_IP_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }
}
