package com.eventscheduler.eventsvc.api.filter;

import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Puts a correlation id in the MDC for the duration of the request and echoes it back.
 * A caller-provided id is reused when it looks sane, otherwise a new one is generated.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private final SecurityUtils securityUtils;

    public CorrelationIdFilter(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String providedId = request.getHeader(CORRELATION_ID_HEADER);
            if (providedId != null && !ACCEPTED_ID.matcher(providedId.trim()).matches()) {
                providedId = null;
            }
            String correlationId = securityUtils.getOrCreateCorrelationId(providedId);

            securityUtils.setMdcContext(correlationId, null);
            response.setHeader(CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);
        } finally {
            securityUtils.clearMdcContext();
        }
    }
}
