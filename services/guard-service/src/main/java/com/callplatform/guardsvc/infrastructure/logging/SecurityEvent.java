package com.callplatform.guardsvc.infrastructure.logging;

import java.time.Instant;
import java.util.Map;

/**
 * A guard decision or detection worth auditing.
 */
public record SecurityEvent(
        String eventType,
        String ipAddress,
        String identifier,
        String correlationId,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) {
    public static SecurityEvent of(String eventType, String ipAddress, String identifier,
                                   String correlationId, String description) {
        return new SecurityEvent(eventType, ipAddress, identifier, correlationId, description, Map.of(), Instant.now());
    }

    public static SecurityEvent of(String eventType, String ipAddress, String identifier,
                                   String correlationId, String description, Map<String, String> metadata) {
        return new SecurityEvent(eventType, ipAddress, identifier, correlationId, description,
                metadata == null ? Map.of() : metadata, Instant.now());
    }
}
