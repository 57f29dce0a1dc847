package com.eventscheduler.eventsvc.infrastructure.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;

/**
 * Sends account emails over SMTP. Failures propagate so the calling task is retried.
 */
@Service
public class EmailSender {

    private static final Logger log = LoggerFactory.getLogger(EmailSender.class);

    private final JavaMailSender mailSender;
    private final boolean enabled;
    private final String from;

    public EmailSender(JavaMailSender mailSender,
                       @Value("${app.mail.enabled:true}") boolean enabled,
                       @Value("${app.mail.from:no-reply@event-scheduler.local}") String from) {
        this.mailSender = mailSender;
        this.enabled = enabled;
        this.from = from;
    }

    public void sendVerificationEmail(String to, String link) {
        send(to, "Validate your email", buildHtml(
                "User validation",
                "Please click the below button to activate your account",
                link,
                "Validate your account"));
    }

    public void sendPasswordResetEmail(String to, String link) {
        send(to, "Reset your password", buildHtml(
                "Password reset",
                "Please click the below button to choose a new password",
                link,
                "Reset password"));
    }

    private void send(String to, String subject, String html) {
        if (!enabled) {
            log.info("Mail disabled, skipping '{}' email", subject);
            return;
        }
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(mime);
            log.debug("Sent '{}' email", subject);
        } catch (MessagingException e) {
            throw new MailPreparationException("Failed to build '" + subject + "' email", e);
        }
    }

    private static String buildHtml(String header, String instruction, String link, String action) {
        String safeLink = HtmlUtils.htmlEscape(link);
        return "<!doctype html>" +
                "<html><head><meta charset='utf-8'><title>" + header + "</title></head>" +
                "<body style='font-family:Arial,Helvetica,sans-serif;color:#1f2937'>" +
                "<h2>" + header + "</h2>" +
                "<p>" + instruction + "</p>" +
                "<p><a href='" + safeLink + "' style='display:inline-block;padding:10px 18px;" +
                "background:#4f46e5;color:#ffffff;border-radius:6px;text-decoration:none'>" + action + "</a></p>" +
                "<p style='color:#6b7280;font-size:12px'>If the button does not work, open " + safeLink + "</p>" +
                "<p style='color:#6b7280;font-size:12px'>No reply</p>" +
                "</body></html>";
    }
}
