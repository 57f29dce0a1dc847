package com.eventscheduler.eventsvc.integration;

import com.eventscheduler.eventsvc.domain.event.EventDraft;
import com.eventscheduler.eventsvc.domain.event.EventService;
import com.eventscheduler.eventsvc.domain.model.Event;
import com.eventscheduler.eventsvc.domain.model.OutboxTask;
import com.eventscheduler.eventsvc.domain.model.TaskKind;
import com.eventscheduler.eventsvc.domain.model.TaskStatus;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.participation.ParticipationService;
import com.eventscheduler.eventsvc.domain.task.TaskDispatcher;
import com.eventscheduler.eventsvc.domain.task.TaskExecutionException;
import com.eventscheduler.eventsvc.domain.task.TaskHandle;
import com.eventscheduler.eventsvc.domain.task.TaskHandler;
import com.eventscheduler.eventsvc.domain.task.TaskMessage;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import com.eventscheduler.eventsvc.infrastructure.scheduling.MaintenanceScheduler;
import com.eventscheduler.eventsvc.infrastructure.worker.TaskWorker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TaskWorkerIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private TaskDispatcher taskDispatcher;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private EventService eventService;

    @Autowired
    private ParticipationService participationService;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private Clock clock;

    @Test
    void shouldSendVerificationEmailOnceEvenWhenRedelivered() throws Exception {
        User user = registeredUser();
        TaskMessage message = messageFor(user.getEmail(), TaskKind.SEND_VERIFICATION_EMAIL);

        assertThat(taskWorker.process(message)).isTrue();
        assertThat(taskWorker.process(message)).isFalse();

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender, times(1)).send(sent.capture());
        assertThat(sent.getValue().getSubject()).isEqualTo("Validate your email");
        assertThat(sent.getValue().getAllRecipients()[0].toString()).isEqualTo(user.getEmail());

        OutboxTask stored = outboxTaskRepository.findById(message.taskId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(stored.getProcessedAt()).isNotNull();
    }

    @Test
    void shouldSendPasswordResetEmailToCurrentAddress() throws Exception {
        User user = verifiedUser();
        TaskHandle handle = enqueue(TaskKind.SEND_PASSWORD_RESET_EMAIL, Map.of(
                "userId", user.getId().toString(),
                "email", user.getEmail()));

        assertThat(taskWorker.process(new TaskMessage(handle.id(), handle.kind(), Map.of(
                "userId", user.getId().toString(),
                "email", user.getEmail())))).isTrue();

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender, times(2)).send(sent.capture());
        MimeMessage reset = sent.getAllValues().get(1);
        assertThat(reset.getSubject()).isEqualTo("Reset your password");
        assertThat(reset.getAllRecipients()[0].toString()).isEqualTo(user.getEmail());
        assertThat((String) reset.getContent()).contains("reset-password?token=");
    }

    @Test
    void shouldSkipVerificationEmailForAlreadyVerifiedUser() {
        User user = verifiedUser();
        TaskHandle handle = enqueue(TaskKind.SEND_VERIFICATION_EMAIL, Map.of(
                "userId", user.getId().toString(),
                "email", user.getEmail()));

        assertThat(taskWorker.process(new TaskMessage(handle.id(), handle.kind(), Map.of(
                "userId", user.getId().toString(),
                "email", user.getEmail())))).isTrue();

        verify(mailSender, times(1)).send(any(MimeMessage.class));
        assertThat(outboxTaskRepository.findById(handle.id()).orElseThrow().getStatus())
                .isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void shouldLeaveTaskPendingWhenHandlerFails() {
        TaskHandle handle = enqueue(TaskKind.SEND_VERIFICATION_EMAIL, Map.of("email", "no-user@example.com"));
        TaskMessage message = new TaskMessage(handle.id(), handle.kind(), Map.of("email", "no-user@example.com"));

        assertThatThrownBy(() -> taskWorker.process(message))
                .isInstanceOf(TaskExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .satisfies(e -> assertThat(((TaskExecutionException) e).getTaskId()).isEqualTo(handle.id()));

        verify(mailSender, never()).send(any(MimeMessage.class));
        assertThat(outboxTaskRepository.findById(handle.id()).orElseThrow().getStatus())
                .isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void shouldIgnoreUnknownTask() {
        assertThat(taskWorker.process(new TaskMessage(UUID.randomUUID(), TaskKind.PURGE_EXPIRED_TOKENS, Map.of())))
                .isFalse();
    }

    @Test
    void shouldTimeOutSlowHandlerAndMarkItFailed() {
        CountDownLatch release = new CountDownLatch(1);
        TaskHandler slow = new TaskHandler() {
            @Override
            public TaskKind kind() {
                return TaskKind.PURGE_EXPIRED_TOKENS;
            }

            @Override
            public void handle(TaskMessage message) throws Exception {
                release.await(5, TimeUnit.SECONDS);
            }
        };
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Counter completed = registry.counter("tasks.completed.total");
        Counter failed = registry.counter("tasks.failed.total");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        TaskWorker worker = new TaskWorker(List.of(slow), outboxTaskRepository, objectMapper, executor,
                transactionTemplate, clock, Duration.ofMillis(200), completed, failed);

        try {
            TaskHandle handle = enqueue(TaskKind.PURGE_EXPIRED_TOKENS, Map.of());
            TaskMessage message = new TaskMessage(handle.id(), handle.kind(), Map.of());

            assertThatThrownBy(() -> worker.process(message))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasMessageContaining("timed out");
            assertThat(outboxTaskRepository.findById(handle.id()).orElseThrow().getStatus())
                    .isEqualTo(TaskStatus.PENDING);

            worker.markFailed(handle.id(), new IllegalStateException("gave up"));

            OutboxTask stored = outboxTaskRepository.findById(handle.id()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(stored.getLastError()).isEqualTo("gave up");
            assertThat(failed.count()).isEqualTo(1.0);
            assertThat(completed.count()).isZero();

            assertThat(worker.process(message)).isFalse();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRejectDuplicateHandlersForOneKind() {
        TaskHandler first = new NoopHandler();
        TaskHandler second = new NoopHandler();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        assertThatThrownBy(() -> new TaskWorker(List.of(first, second), outboxTaskRepository, objectMapper,
                Executors.newSingleThreadExecutor(), transactionTemplate, clock, Duration.ofSeconds(1),
                registry.counter("completed"), registry.counter("failed")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PURGE_EXPIRED_TOKENS");
    }

    @Test
    void shouldRepairDriftedParticipantsCount() {
        Event event = eventService.create(verifiedUser().getId(), new EventDraft(
                "Recount me", null, Instant.now().plus(Duration.ofDays(3)), null, null));
        participationService.join(registeredUser().getId(), event.getSlug());

        transactionTemplate.executeWithoutResult(tx ->
                eventRepository.findById(event.getId()).orElseThrow().setParticipantsCount(7));

        TaskHandle handle = enqueue(TaskKind.RECOUNT_PARTICIPANTS, Map.of("offset", "0", "limit", "100000"));
        assertThat(taskWorker.process(new TaskMessage(handle.id(), handle.kind(),
                Map.of("offset", "0", "limit", "100000")))).isTrue();

        assertThat(eventRepository.findById(event.getId()).orElseThrow().getParticipantsCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidRecountChunk() {
        TaskHandle handle = enqueue(TaskKind.RECOUNT_PARTICIPANTS, Map.of("offset", "0", "limit", "0"));

        assertThatThrownBy(() -> taskWorker.process(new TaskMessage(handle.id(), handle.kind(),
                Map.of("offset", "0", "limit", "0"))))
                .isInstanceOf(TaskExecutionException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldScheduleRecountChunksAndPurgeCompletedTasks() {
        MaintenanceScheduler scheduler = new MaintenanceScheduler(
                taskDispatcher, eventRepository, outboxTaskRepository, clock, 2, Duration.ZERO);
        eventService.create(verifiedUser().getId(), new EventDraft(
                "Chunked", null, Instant.now().plus(Duration.ofDays(2)), null, null));

        TaskHandle completedTask = enqueue(TaskKind.PURGE_EXPIRED_TOKENS, Map.of());
        assertThat(taskWorker.process(new TaskMessage(completedTask.id(), completedTask.kind(), Map.of()))).isTrue();

        long before = outboxTaskRepository.findByKindOrderByCreatedAtAsc(TaskKind.RECOUNT_PARTICIPANTS).size();
        long events = eventRepository.count();
        transactionTemplate.executeWithoutResult(tx -> scheduler.scheduleParticipantRecount());
        long after = outboxTaskRepository.findByKindOrderByCreatedAtAsc(TaskKind.RECOUNT_PARTICIPANTS).size();
        assertThat(after - before).isEqualTo((events + 1) / 2);

        transactionTemplate.executeWithoutResult(tx -> scheduler.schedulePurge());
        assertThat(outboxTaskRepository.findById(completedTask.id())).isEmpty();
        assertThat(outboxTaskRepository.findByKindOrderByCreatedAtAsc(TaskKind.PURGE_EXPIRED_TOKENS))
                .anyMatch(task -> task.getStatus() == TaskStatus.PENDING);
    }

    private TaskHandle enqueue(TaskKind kind, Map<String, String> payload) {
        return transactionTemplate.execute(tx -> taskDispatcher.enqueue(kind, payload));
    }

    private TaskMessage messageFor(String email, TaskKind kind) throws Exception {
        for (OutboxTask task : outboxTaskRepository.findByKindOrderByCreatedAtAsc(kind)) {
            Map<String, String> payload = objectMapper.readValue(task.getPayloadJson(),
                    objectMapper.getTypeFactory().constructMapType(Map.class, String.class, String.class));
            if (email.equals(payload.get("email"))) {
                return new TaskMessage(task.getId(), kind, payload);
            }
        }
        throw new AssertionError("No " + kind + " task for " + email);
    }

    private static final class NoopHandler implements TaskHandler {

        @Override
        public TaskKind kind() {
            return TaskKind.PURGE_EXPIRED_TOKENS;
        }

        @Override
        public void handle(TaskMessage message) {
        }
    }
}
