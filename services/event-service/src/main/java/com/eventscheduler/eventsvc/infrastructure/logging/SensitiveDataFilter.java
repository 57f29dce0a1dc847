package com.eventscheduler.eventsvc.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.regex.Pattern;

/**
 * Logback filter, attached to the appenders in {@code logback-spring.xml}, that drops log lines
 * carrying a secret in {@code key=value} or {@code key: value} form.
 */
public class SensitiveDataFilter extends Filter<ILoggingEvent> {

    static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwordHash|confirmPassword|token|secret|apiKey|authorization)\\s*[=:]\\s*\\S+");

    @Override
    public FilterReply decide(ILoggingEvent event) {
        return containsSecret(event.getFormattedMessage()) ? FilterReply.DENY : FilterReply.NEUTRAL;
    }

    public static boolean containsSecret(String message) {
        return message != null && SECRET_ASSIGNMENT.matcher(message).find();
    }
}
