package com.eventscheduler.eventsvc.integration;

import com.eventscheduler.eventsvc.api.dto.request.EmailRequest;
import com.eventscheduler.eventsvc.api.dto.request.EmailVerificationRequest;
import com.eventscheduler.eventsvc.api.dto.request.LoginRequest;
import com.eventscheduler.eventsvc.api.dto.request.PasswordResetConfirmRequest;
import com.eventscheduler.eventsvc.api.dto.request.ProfileUpdateRequest;
import com.eventscheduler.eventsvc.api.dto.request.UserRegistrationRequest;
import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TokenPurpose;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.model.UserStatus;
import com.eventscheduler.eventsvc.domain.token.VerificationTokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AccountFlowIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private VerificationTokenService tokenService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    void shouldRegisterUnverifiedUserAndQueueVerificationEmail() throws Exception {
        String email = uniqueEmail();

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new UserRegistrationRequest(email, PASSWORD, PASSWORD))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.verified").value(false))
                .andExpect(jsonPath("$.slug").isNotEmpty())
                .andExpect(header().exists("X-Correlation-ID"));

        User user = userRepository.findByEmail(email).orElseThrow();
        assertThat(user.isEmailVerified()).isFalse();
        assertThat(user.getPasswordHash()).startsWith("$argon2id$").doesNotContain(PASSWORD);
        assertThat(tasksFor(email, TaskKind.SEND_VERIFICATION_EMAIL)).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateEmailRegardlessOfCase() throws Exception {
        User existing = registeredUser();

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new UserRegistrationRequest(
                                existing.getEmail().toUpperCase(), PASSWORD, PASSWORD))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("EMAIL_EXISTS"));
    }

    @Test
    void shouldReportFieldErrorsForWeakPassword() throws Exception {
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new UserRegistrationRequest(uniqueEmail(), "short", "other"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.extensions.errors[?(@.code == 'TOO_SHORT')]").exists())
                .andExpect(jsonPath("$.extensions.errors[?(@.field == 'confirmPassword')]").exists());
    }

    @Test
    void shouldRejectMissingBodyFields() throws Exception {
        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldVerifyEmailOnceThenReportTokenUsed() throws Exception {
        User user = registeredUser();
        String token = latestToken(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL);

        mockMvc.perform(post("/api/v1/users/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailVerificationRequest(token))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.emailVerified").value(true));

        mockMvc.perform(post("/api/v1/users/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailVerificationRequest(token))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_USED"));

        assertThat(userRepository.findById(user.getId()).orElseThrow().isEmailVerified()).isTrue();
    }

    @Test
    void shouldRejectUnknownToken() throws Exception {
        mockMvc.perform(post("/api/v1/users/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailVerificationRequest("no-such-token"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TOKEN"));
    }

    @Test
    void shouldResendVerificationWhenTokenExpired() throws Exception {
        User user = registeredUser();
        String expired = transactionTemplate.execute(tx -> tokenService.issue(
                userRepository.findById(user.getId()).orElseThrow(),
                TokenPurpose.EMAIL_VERIFICATION, Duration.ZERO).rawValue());
        long queuedBefore = tasksFor(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL);

        mockMvc.perform(post("/api/v1/users/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailVerificationRequest(expired))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("EXPIRED_TOKEN"));

        assertThat(tasksFor(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL)).isEqualTo(queuedBefore + 1);
        assertThat(userRepository.findById(user.getId()).orElseThrow().isEmailVerified()).isFalse();
    }

    @Test
    void shouldAcceptResendForUnknownEmailWithoutQueueingMail() throws Exception {
        String email = uniqueEmail();

        mockMvc.perform(post("/api/v1/users/resend-verification")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailRequest(email))))
                .andExpect(status().isAccepted());

        assertThat(tasksFor(email, TaskKind.SEND_VERIFICATION_EMAIL)).isZero();
    }

    @Test
    void shouldLimitResendsPerEmail() throws Exception {
        User user = registeredUser();

        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/v1/users/resend-verification")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new EmailRequest(user.getEmail()))))
                    .andExpect(status().isAccepted());
        }

        mockMvc.perform(post("/api/v1/users/resend-verification")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailRequest(user.getEmail()))))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.errorCode").value("RATE_LIMITED"));

        assertThat(tasksFor(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL)).isEqualTo(4);
    }

    @Test
    void shouldLoginWithValidCredentialsOnly() throws Exception {
        User user = registeredUser();

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andExpect(jsonPath("$.verified").value(false));

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "Wr0ngPassword"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("INVALID_CREDENTIALS"));

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(uniqueEmail(), PASSWORD))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("INVALID_CREDENTIALS"));
    }

    @Test
    void shouldResetPasswordWithSingleUseToken() throws Exception {
        User user = verifiedUser();

        mockMvc.perform(post("/api/v1/users/password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailRequest(user.getEmail()))))
                .andExpect(status().isAccepted());
        String token = latestToken(user.getEmail(), TaskKind.SEND_PASSWORD_RESET_EMAIL);

        mockMvc.perform(post("/api/v1/users/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new PasswordResetConfirmRequest(token, "N3wPassword", "N3wPassword"))))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/v1/users/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new PasswordResetConfirmRequest(token, "An0therOne", "An0therOne"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_USED"));

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "N3wPassword"))))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldNotAcceptVerificationTokenForPasswordReset() throws Exception {
        User user = registeredUser();
        String verificationToken = latestToken(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL);

        mockMvc.perform(post("/api/v1/users/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new PasswordResetConfirmRequest(
                                verificationToken, "N3wPassword", "N3wPassword"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_TOKEN"));
    }

    @Test
    void shouldKeepRawTokensOutOfQueuedTasks() throws Exception {
        User user = verifiedUser();
        mockMvc.perform(post("/api/v1/users/password-reset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new EmailRequest(user.getEmail()))))
                .andExpect(status().isAccepted());
        String resetToken = latestToken(user.getEmail(), TaskKind.SEND_PASSWORD_RESET_EMAIL);

        List<OutboxTask> tasks = outboxTaskRepository.findAll().stream()
                .filter(task -> task.getPayloadJson().contains(user.getId().toString()))
                .toList();
        assertThat(tasks).extracting(OutboxTask::getKind)
                .contains(TaskKind.SEND_VERIFICATION_EMAIL, TaskKind.SEND_PASSWORD_RESET_EMAIL);
        for (OutboxTask task : tasks) {
            assertThat(task.getPayloadJson()).doesNotContain(resetToken).doesNotContain("token=");
            assertThat(objectMapper.readTree(task.getPayloadJson()).fieldNames())
                    .toIterable()
                    .containsExactlyInAnyOrder("userId", "email");
        }

        mockMvc.perform(post("/api/v1/users/password-reset/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new PasswordResetConfirmRequest(resetToken, "N3wPassword", "N3wPassword"))))
                .andExpect(status().isNoContent());
    }

    @Test
    void shouldRequireAuthenticationForProfile() throws Exception {
        mockMvc.perform(get("/api/v1/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.instance").value("/api/v1/me"));

        mockMvc.perform(get("/api/v1/me").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"));
    }

    @Test
    void shouldReturnAndUpdateProfile() throws Exception {
        User user = verifiedUser();
        String newEmail = uniqueEmail();

        mockMvc.perform(get("/api/v1/me").header(HttpHeaders.AUTHORIZATION, bearer(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(user.getEmail()))
                .andExpect(jsonPath("$.emailVerified").value(true));

        mockMvc.perform(patch("/api/v1/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ProfileUpdateRequest(newEmail))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(newEmail))
                .andExpect(jsonPath("$.emailVerified").value(false));

        assertThat(tasksFor(newEmail, TaskKind.SEND_VERIFICATION_EMAIL)).isEqualTo(1);
    }

    @Test
    void shouldRejectProfileUpdateToTakenOrSameEmail() throws Exception {
        User user = registeredUser();
        User other = registeredUser();

        mockMvc.perform(patch("/api/v1/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ProfileUpdateRequest(other.getEmail()))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("EMAIL_EXISTS"));

        mockMvc.perform(patch("/api/v1/me")
                        .header(HttpHeaders.AUTHORIZATION, bearer(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ProfileUpdateRequest(user.getEmail()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.extensions.errors[0].code").value("UNCHANGED"));
    }

    @Test
    void shouldDisableAccountAndRejectFurtherUse() throws Exception {
        User user = verifiedUser();
        String authorization = bearer(user);

        mockMvc.perform(delete("/api/v1/me").header(HttpHeaders.AUTHORIZATION, authorization))
                .andExpect(status().isNoContent());

        assertThat(userRepository.findById(user.getId()).orElseThrow().getStatus()).isEqualTo(UserStatus.DISABLED);
        mockMvc.perform(get("/api/v1/me").header(HttpHeaders.AUTHORIZATION, authorization))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("USER_NOT_FOUND"));
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD))))
                .andExpect(status().isUnauthorized());
    }
}
