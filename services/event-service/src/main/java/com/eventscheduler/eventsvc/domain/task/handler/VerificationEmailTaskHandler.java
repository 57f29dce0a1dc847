package com.eventscheduler.eventsvc.domain.task.handler;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.domain.verification.AccountLink;
import com.eventscheduler.eventsvc.domain.verification.AccountMailer;
import com.eventscheduler.eventsvc.infrastructure.mail.EmailSender;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Each run issues a new token, so a duplicate run mails a newer link and retires the earlier one.
 */
@Component
@RequiredArgsConstructor
public class VerificationEmailTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(VerificationEmailTaskHandler.class);

    private final AccountMailer accountMailer;
    private final EmailSender emailSender;

    @Override
    public TaskKind kind() {
        return TaskKind.SEND_VERIFICATION_EMAIL;
    }

    @Override
    public void handle(TaskMessage message) {
        UUID userId = UUID.fromString(message.require("userId"));
        Optional<AccountLink> link = accountMailer.verificationLink(userId);
        if (link.isEmpty()) {
            log.debug("No verification email needed: userId={}", userId);
            return;
        }
        emailSender.sendVerificationEmail(link.get().email(), link.get().url());
    }
}
