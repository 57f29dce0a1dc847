package com.eventscheduler.eventsvc.integration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs in its own context with a tiny per-IP budget. Each test uses its own client address.
 */
@SpringBootTest(properties = {
        "app.rate-limit.requests-per-window=3",
        "app.rate-limit.bypass-paths=/api/v1/users/verify",
        "spring.datasource.url=jdbc:h2:mem:ratelimit;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1"
})
@ActiveProfiles("test")
@AutoConfigureMockMvc
class RateLimitIntegrationTest {

    @MockBean
    private JavaMailSender mailSender;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldRejectRequestsBeyondTheWindowBudget() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/api/v1/events").header("X-Forwarded-For", "203.0.113.10"))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/v1/events").header("X-Forwarded-For", "203.0.113.10"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.errorCode").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.extensions.retryAfter", greaterThan(0)))
                .andExpect(jsonPath("$.extensions.retryAfter", lessThanOrEqualTo(3600)));
    }

    @Test
    void shouldCountClientsIndependently() throws Exception {
        for (int i = 0; i < 4; i++) {
            mockMvc.perform(get("/api/v1/events").header("X-Forwarded-For", "203.0.113.20"));
        }

        mockMvc.perform(get("/api/v1/events").header("X-Forwarded-For", "203.0.113.21, 10.0.0.1"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/events").header("X-Real-IP", "203.0.113.22"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldNotLimitBypassedPaths() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(get("/api/v1/events").header("X-Forwarded-For", "203.0.113.30"));
        }

        for (int i = 0; i < 5; i++) {
            mockMvc.perform(post("/api/v1/users/verify")
                            .header("X-Forwarded-For", "203.0.113.30")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"token\":\"not-a-real-token\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorCode").value("INVALID_TOKEN"));
        }
        mockMvc.perform(get("/health/ready").header("X-Forwarded-For", "203.0.113.30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database.status").value("UP"))
                .andExpect(jsonPath("$.rateLimitStore.store").value("local"));
    }
}
