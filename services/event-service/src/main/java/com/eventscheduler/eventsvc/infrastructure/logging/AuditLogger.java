package com.eventscheduler.eventsvc.infrastructure.logging;

import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes audit and security events as single-line JSON to the {@code AUDIT} logger.
 */
@Component
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");
    private static final String SERVICE_ID = "event-service";

    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    public AuditLogger(SecurityUtils securityUtils, ObjectMapper objectMapper) {
        this.securityUtils = securityUtils;
        this.objectMapper = objectMapper;
    }

    public void logAudit(AuditEvent event) {
        write("AUDIT", event.eventType(), event.description(), event.userId(), event.correlationId(),
                event.metadata());
    }

    public void logSecurity(SecurityEvent event) {
        Map<String, String> metadata = new LinkedHashMap<>(event.metadata());
        if (event.ipAddress() != null) {
            metadata.put("maskedIp", securityUtils.maskIp(event.ipAddress()));
        }
        if (event.email() != null) {
            metadata.put("maskedEmail", securityUtils.maskEmail(event.email()));
        }
        write("SECURITY", event.eventType(), event.description(), null, event.correlationId(), metadata);
    }

    private void write(String level, String eventType, String description,
                       String userId, String correlationId, Map<String, String> metadata) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("eventType", eventType);
        entry.put("description", description);
        entry.put("serviceId", SERVICE_ID);
        entry.put("correlationId", correlationId);
        if (userId != null) {
            entry.put("userId", userId);
        }
        if (metadata != null && !metadata.isEmpty()) {
            entry.put("metadata", metadata);
        }

        try {
            String json = objectMapper.writeValueAsString(entry);
            if ("SECURITY".equals(level)) {
                audit.warn("[SECURITY] {}", json);
            } else {
                audit.info("[AUDIT] {}", json);
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event {}: {}", level, eventType, e.getMessage());
        }
    }
}
