package com.eventscheduler.eventsvc.domain.task.handler;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.domain.verification.AccountMailer;
import com.eventscheduler.eventsvc.infrastructure.mail.EmailSender;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class PasswordResetEmailTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetEmailTaskHandler.class);

    private final AccountMailer accountMailer;
    private final EmailSender emailSender;

    @Override
    public TaskKind kind() {
        return TaskKind.SEND_PASSWORD_RESET_EMAIL;
    }

    @Override
    public void handle(TaskMessage message) {
        UUID userId = UUID.fromString(message.require("userId"));
        accountMailer.passwordResetLink(userId).ifPresentOrElse(
                link -> emailSender.sendPasswordResetEmail(link.email(), link.url()),
                () -> log.debug("Skipping password reset email for inactive or unknown user: userId={}", userId));
    }
}
