package com.eventscheduler.eventsvc.domain.task.handler;

import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.domain.token.VerificationTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
@Slf4j
public class PurgeExpiredTokensTaskHandler implements TaskHandler {

    private final VerificationTokenService tokenService;
    private final Clock clock;
    private final Duration retention;

    public PurgeExpiredTokensTaskHandler(VerificationTokenService tokenService,
                                         Clock clock,
                                         @Value("${app.tokens.retention:P7D}") Duration retention) {
        this.tokenService = tokenService;
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PURGE_EXPIRED_TOKENS;
    }

    @Override
    public void handle(TaskMessage message) {
        int deleted = tokenService.purgeSettledBefore(clock.instant().minus(retention));
        log.info("Purged {} settled verification tokens", deleted);
    }
}
