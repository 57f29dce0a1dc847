package com.eventscheduler.eventsvc.config;

import com.eventscheduler.eventsvc.api.error.ProblemDetail;
import com.eventscheduler.eventsvc.shared.security.SecurityUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

/**
 * Stateless bearer-token security. Account flows and event browsing are public; everything else
 * needs a JWT issued by {@code /api/v1/auth/login}. Rejections use the same problem body as the API.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String[] PUBLIC_POSTS = {
            "/api/v1/users",
            "/api/v1/auth/login",
            "/api/v1/users/verify",
            "/api/v1/users/resend-verification",
            "/api/v1/users/password-reset",
            "/api/v1/users/password-reset/confirm"
    };

    private static final String[] PUBLIC_PATHS = {
            "/health/**", "/actuator/**", "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html", "/error"
    };

    private final JwtAuthConverter jwtAuthConverter;
    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        AuthenticationEntryPoint entryPoint = (request, response, ex) -> {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            writeProblem(request, response, "UNAUTHORIZED", HttpServletResponse.SC_UNAUTHORIZED,
                    "Authentication is required");
        };
        AccessDeniedHandler accessDeniedHandler = (request, response, ex) ->
                writeProblem(request, response, "FORBIDDEN", HttpServletResponse.SC_FORBIDDEN, "Access is denied");

        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST, PUBLIC_POSTS).permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/events", "/api/v1/events/*").permitAll()
                .requestMatchers(PUBLIC_PATHS).permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(handling -> handling
                .authenticationEntryPoint(entryPoint)
                .accessDeniedHandler(accessDeniedHandler)
            )
            .oauth2ResourceServer(oauth2 -> oauth2
                .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                .authenticationEntryPoint(entryPoint)
            );

        return http.build();
    }

    private void writeProblem(HttpServletRequest request, HttpServletResponse response,
                              String errorCode, int status, String detail) throws IOException {
        ProblemDetail problem = ProblemDetail.forCode(errorCode, status, detail, request.getRequestURI(),
                securityUtils.getCurrentCorrelationId());
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
