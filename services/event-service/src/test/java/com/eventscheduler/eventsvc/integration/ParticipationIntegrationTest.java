package com.eventscheduler.eventsvc.integration;

import com.eventscheduler.eventsvc.domain.event.EventDraft;
import com.eventscheduler.eventsvc.domain.event.EventService;
import com.eventscheduler.eventsvc.domain.model.Event;
import com.eventscheduler.eventsvc.domain.model.User;
import com.eventscheduler.eventsvc.domain.participation.ParticipationService;
import com.eventscheduler.eventsvc.infra.persistence.EventRepository;
import com.eventscheduler.eventsvc.infra.persistence.ParticipationRepository;
import com.eventscheduler.eventsvc.shared.exception.AlreadyJoinedException;
import com.eventscheduler.eventsvc.shared.exception.CapacityExceededException;
import com.eventscheduler.eventsvc.shared.exception.NotAParticipantException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ParticipationIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private EventService eventService;

    @Autowired
    private ParticipationService participationService;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private ParticipationRepository participationRepository;

    @Test
    void shouldJoinAndWithdrawThroughApi() throws Exception {
        Event event = event(verifiedUser(), null);
        User participant = registeredUser();

        mockMvc.perform(post("/api/v1/events/{slug}/participants", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(participant)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.joined").value(true));

        mockMvc.perform(get("/api/v1/events/{slug}", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(participant)))
                .andExpect(jsonPath("$.joined").value(true))
                .andExpect(jsonPath("$.participantsCount").value(1));

        mockMvc.perform(post("/api/v1/events/{slug}/participants", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(participant)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_JOINED"));

        mockMvc.perform(delete("/api/v1/events/{slug}/participants", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(participant)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/events/{slug}", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(participant)))
                .andExpect(jsonPath("$.joined").value(false))
                .andExpect(jsonPath("$.participantsCount").value(0));
    }

    @Test
    void shouldRejectWithdrawalOfNonParticipantWithoutChanges() {
        Event event = event(verifiedUser(), 5);
        User member = registeredUser();
        User outsider = registeredUser();
        participationService.join(member.getId(), event.getSlug());

        assertThatThrownBy(() -> participationService.withdraw(outsider.getId(), event.getSlug()))
                .isInstanceOf(NotAParticipantException.class);

        assertThat(participationRepository.countByEventId(event.getId())).isEqualTo(1);
        assertThat(eventRepository.findBySlug(event.getSlug()).orElseThrow().getParticipantsCount()).isEqualTo(1);
    }

    @Test
    void shouldReturnNotFoundWhenWithdrawingWithoutJoining() throws Exception {
        Event event = event(verifiedUser(), null);

        mockMvc.perform(delete("/api/v1/events/{slug}/participants", event.getSlug())
                        .header(HttpHeaders.AUTHORIZATION, bearer(registeredUser())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_A_PARTICIPANT"));
    }

    @Test
    void shouldRejectJoinWhenFull() {
        Event event = event(verifiedUser(), 1);
        participationService.join(registeredUser().getId(), event.getSlug());

        assertThatThrownBy(() -> participationService.join(registeredUser().getId(), event.getSlug()))
                .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    void shouldAdmitExactlyTwoOfThreeConcurrentJoins() throws Exception {
        Event event = event(verifiedUser(), 2);
        List<User> users = List.of(registeredUser(), registeredUser(), registeredUser());

        List<Throwable> outcomes = joinConcurrently(event.getSlug(), users);

        assertThat(outcomes.stream().filter(o -> o == null).count()).isEqualTo(2);
        assertThat(outcomes.stream().filter(o -> o instanceof CapacityExceededException).count()).isEqualTo(1);
        assertThat(participationRepository.countByEventId(event.getId())).isEqualTo(2);
        assertThat(eventRepository.findBySlug(event.getSlug()).orElseThrow().getParticipantsCount()).isEqualTo(2);
    }

    @Test
    void shouldNeverExceedCapacityUnderContention() throws Exception {
        int capacity = 5;
        int extra = 4;
        Event event = event(verifiedUser(), capacity);
        List<User> users = new ArrayList<>();
        for (int i = 0; i < capacity + extra; i++) {
            users.add(registeredUser());
        }

        List<Throwable> outcomes = joinConcurrently(event.getSlug(), users);

        assertThat(outcomes.stream().filter(o -> o == null).count()).isEqualTo(capacity);
        assertThat(outcomes.stream().filter(o -> o instanceof CapacityExceededException).count()).isEqualTo(extra);
        assertThat(participationRepository.countByEventId(event.getId())).isEqualTo(capacity);
    }

    @Test
    void shouldJoinOnlyOnceWhenSameUserRacesItself() throws Exception {
        Event event = event(verifiedUser(), null);
        User user = registeredUser();

        List<Throwable> outcomes = joinConcurrently(event.getSlug(), List.of(user, user, user));

        assertThat(outcomes.stream().filter(o -> o == null).count()).isEqualTo(1);
        assertThat(outcomes.stream().filter(o -> o instanceof AlreadyJoinedException).count()).isEqualTo(2);
        assertThat(participationRepository.countByEventId(event.getId())).isEqualTo(1);
    }

    private List<Throwable> joinConcurrently(String slug, List<User> users) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(users.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (User user : users) {
            Callable<Object> join = () -> {
                start.await();
                return participationService.join(user.getId(), slug);
            };
            futures.add(executor.submit(join));
        }
        start.countDown();

        List<Throwable> outcomes = new ArrayList<>();
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                outcomes.add(null);
            } catch (ExecutionException e) {
                outcomes.add(e.getCause());
            } catch (TimeoutException e) {
                throw new AssertionError("join did not finish", e);
            }
        }
        executor.shutdownNow();
        return outcomes;
    }

    private Event event(User creator, Integer capacity) {
        return eventService.create(creator.getId(), new EventDraft(
                "Workshop", "Hands-on session", Instant.now().plus(Duration.ofDays(5)), null, capacity));
    }
}
