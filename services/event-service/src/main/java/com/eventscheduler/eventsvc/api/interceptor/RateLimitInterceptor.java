package com.eventscheduler.eventsvc.api.interceptor;

import com.eventscheduler.eventsvc.domain.ratelimit.RateLimitService;
import com.eventscheduler.eventsvc.infrastructure.logging.AuditLogger;
import com.eventscheduler.eventsvc.infrastructure.logging.SecurityEvent;
import com.eventscheduler.eventsvc.shared.exception.RateLimitedException;
import com.eventscheduler.eventsvc.shared.security.ClientIpResolver;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Counts every API request against the caller's IP window. A blocked request is rethrown as
 * {@link RateLimitedException} so the exception handler writes the 429 body and Retry-After header.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimitService rateLimitService;
    private final ClientIpResolver clientIpResolver;
    private final AuditLogger auditLogger;
    private final SecurityUtils securityUtils;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!rateLimitService.isEnabled()) {
            return true;
        }
        String ipAddress = clientIpResolver.resolve(request);
        try {
            rateLimitService.checkRequestLimit(ipAddress);
            return true;
        } catch (RateLimitedException e) {
            log.debug("Request blocked by rate limit: path={}", request.getRequestURI());
            auditLogger.logSecurity(SecurityEvent.of(
                    "RATE_LIMITED", ipAddress, null, securityUtils.getCurrentCorrelationId(),
                    request.getMethod() + " " + request.getRequestURI()));
            throw e;
        }
    }
}
