package com.eventscheduler.eventsvc.integration;

import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.registration.RegistrationResult;
import com.eventscheduler.eventsvc.domain.registration.RegistrationService;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.domain.verification.EmailVerificationService;
import com.eventscheduler.eventsvc.infra.persistence.OutboxTaskRepository;
import com.eventscheduler.eventsvc.infra.persistence.UserRepository;
import com.eventscheduler.eventsvc.infrastructure.worker.TaskWorker;
import com.eventscheduler.eventsvc.shared.security.JwtTokenService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Boots the whole service against in-memory H2 with the relay, the worker and the schedulers switched off.
 * Every test works with fresh email addresses so classes can share one context.
 */
@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
public abstract class IntegrationTestSupport {

    protected static final String PASSWORD = "Str0ngPassword";

    private static final TypeReference<Map<String, String>> PAYLOAD_TYPE = new TypeReference<>() {
    };
    private static final Pattern TOKEN_IN_LINK = Pattern.compile("token=([0-9A-Za-z%_-]+)");

    @MockBean
    protected JavaMailSender mailSender;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected RegistrationService registrationService;

    @Autowired
    protected EmailVerificationService emailVerificationService;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected OutboxTaskRepository outboxTaskRepository;

    @Autowired
    protected JwtTokenService jwtTokenService;

    @Autowired
    protected TaskWorker taskWorker;

    @BeforeEach
    void stubMailSender() {
        when(mailSender.createMimeMessage()).thenAnswer(invocation -> new MimeMessage((Session) null));
    }

    protected static String uniqueEmail() {
        return "user-" + UUID.randomUUID().toString().substring(0, 12) + "@example.com";
    }

    protected User registeredUser() {
        RegistrationResult result = registrationService.register(uniqueEmail(), PASSWORD, PASSWORD);
        return userRepository.findById(result.userId()).orElseThrow();
    }

    protected User verifiedUser() {
        User user = registeredUser();
        emailVerificationService.verify(latestToken(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL));
        return userRepository.findById(user.getId()).orElseThrow();
    }

    protected String bearer(User user) {
        return "Bearer " + jwtTokenService.issue(user.getId()).value();
    }

    /**
     * Runs the email tasks queued for {@code email} through the worker, then returns the raw token
     * from the link in the newest such email handed to the mail sender.
     */
    protected String latestToken(String email, TaskKind kind) {
        for (OutboxTask task : outboxTaskRepository.findByKindOrderByCreatedAtAsc(kind)) {
            JsonNode payload = readPayload(task);
            if (email.equals(payload.path("email").asText())) {
                taskWorker.process(new TaskMessage(task.getId(), kind,
                        objectMapper.convertValue(payload, PAYLOAD_TYPE)));
            }
        }

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender, atLeast(0)).send(sent.capture());
        List<MimeMessage> messages = sent.getAllValues();
        for (int i = messages.size() - 1; i >= 0; i--) {
            MimeMessage message = messages.get(i);
            if (isAddressedTo(message, email) && subjectOf(message).equals(subjectFor(kind))) {
                Matcher matcher = TOKEN_IN_LINK.matcher(contentOf(message));
                if (matcher.find()) {
                    return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
                }
            }
        }
        throw new AssertionError("No " + kind + " email sent to " + email);
    }

    protected long tasksFor(String email, TaskKind kind) {
        return outboxTaskRepository.findByKindOrderByCreatedAtAsc(kind).stream()
                .filter(task -> email.equals(readPayload(task).path("email").asText()))
                .count();
    }

    protected String json(Object body) throws JsonProcessingException {
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode readPayload(OutboxTask task) {
        try {
            return objectMapper.readTree(task.getPayloadJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable payload for task " + task.getId(), e);
        }
    }

    private static String subjectFor(TaskKind kind) {
        return kind == TaskKind.SEND_PASSWORD_RESET_EMAIL ? "Reset your password" : "Validate your email";
    }

    private static boolean isAddressedTo(MimeMessage message, String email) {
        try {
            Address[] recipients = message.getAllRecipients();
            return recipients != null && recipients.length > 0 && email.equals(recipients[0].toString());
        } catch (MessagingException e) {
            throw new IllegalStateException("Unreadable recipients", e);
        }
    }

    private static String subjectOf(MimeMessage message) {
        try {
            return String.valueOf(message.getSubject());
        } catch (MessagingException e) {
            throw new IllegalStateException("Unreadable subject", e);
        }
    }

    private static String contentOf(MimeMessage message) {
        try {
            return String.valueOf(message.getContent());
        } catch (MessagingException | IOException e) {
            throw new IllegalStateException("Unreadable email body", e);
        }
    }
}
