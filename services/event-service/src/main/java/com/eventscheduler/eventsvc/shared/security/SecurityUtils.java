package com.eventscheduler.eventsvc.shared.security;

import org.slf4j.MDC;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Masking, correlation id and MDC helpers, plus access to the authenticated user id.
 */
@Component
public class SecurityUtils {

    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String USER_ID_KEY = "userId";
    private static final Pattern IPV4_PATTERN = Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\\.\\d{1,3}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^(.{2})([^@]*)(@.+)$");

    /**
     * Masks the last IPv4 octet: 192.168.1.100 -> 192.168.1.***
     */
    public String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "***";
        }
        var matcher = IPV4_PATTERN.matcher(ip.trim());
        if (matcher.matches()) {
            return matcher.group(1) + ".***";
        }
        return ip.length() > 6 ? ip.substring(0, 6) + "***" : "***";
    }

    /**
     * Keeps the first two characters of the local part: john.doe@example.com -> jo***@example.com
     */
    public String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        var matcher = EMAIL_PATTERN.matcher(email.trim().toLowerCase());
        if (matcher.matches()) {
            return matcher.group(1) + "***" + matcher.group(3);
        }
        return email.length() > 2 ? email.substring(0, 2) + "***" : "***";
    }

    public String getOrCreateCorrelationId(String provided) {
        if (provided != null && !provided.isBlank()) {
            return provided.trim();
        }
        return UUID.randomUUID().toString();
    }

    public void setMdcContext(String correlationId, String userId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        if (userId != null) {
            MDC.put(USER_ID_KEY, userId);
        }
    }

    public void clearMdcContext() {
        MDC.remove(CORRELATION_ID_KEY);
        MDC.remove(USER_ID_KEY);
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    /**
     * Id of the user behind the current JWT, if the request is authenticated.
     */
    public Optional<UUID> currentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof Jwt jwt)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(jwt.getSubject()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * @throws AuthenticationCredentialsNotFoundException when the request carries no valid JWT
     */
    public UUID requireCurrentUserId() {
        return currentUserId().orElseThrow(
                () -> new AuthenticationCredentialsNotFoundException("Authentication is required"));
    }
}
