package io.strata.store.integration;

import io.strata.core.event.Event;
import io.strata.core.event.EventBus;
import io.strata.core.event.EventListener;
import io.strata.core.lifecycle.ExpirySweeper;
import io.strata.store.EntityStore;
import io.strata.store.MutableClock;
import io.strata.store.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Integration tests wiring store mutations to bus events.
 *
 * @author Test Engineer
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EntityStore + EventBus Integration")
class StoreEventIntegrationTest {

    private MutableClock clock;
    private EntityStore<Task> tasks;
    private EventBus bus;
    private TaskService service;

    @Mock
    private EventListener audit;

    @Mock
    private EventListener first;

    @Mock
    private EventListener last;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        tasks = EntityStore.builder(Task.class).name("task").clock(clock).build();
        bus = EventBus.create();
        service = new TaskService(tasks, bus);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    @DisplayName("should publish created and updated events with the stored entity")
    void shouldPublishMutations() {
        Task created = service.create("Buy milk");
        service.rename(created.id(), "Buy oat milk");

        List<Event> history = bus.getEventHistory();
        assertThat(history).extracting(Event::type).containsExactly("task:created", "task:updated");
        assertThat(history.get(0).dataAs(Task.class).id()).isEqualTo(created.id());
        assertThat(history.get(1).dataAs(Task.class).title()).isEqualTo("Buy oat milk");
        assertThat(history).extracting(Event::source).containsOnly("task-service");
    }

    @Test
    @DisplayName("should let a wildcard audit listener see every mutation")
    void shouldAuditEverything() throws Exception {
        bus.subscribe(EventBus.WILDCARD, audit);

        Task created = service.create("Buy milk");
        service.rename(created.id(), "Buy bread");
        service.remove(created.id());

        verify(audit, times(3)).onEvent(any(Event.class));
        assertThat(bus.getEventHistory("task:deleted")).hasSize(1);
    }

    @Test
    @DisplayName("should deliver synchronously in subscription order")
    void shouldDeliverInOrder() throws Exception {
        bus.subscribe("task:created", first);
        bus.subscribe(EventBus.WILDCARD, audit);
        bus.subscribe("task:created", last);

        service.create("Buy milk");

        InOrder inOrder = inOrder(first, audit, last);
        inOrder.verify(first).onEvent(any(Event.class));
        inOrder.verify(audit).onEvent(any(Event.class));
        inOrder.verify(last).onEvent(any(Event.class));
    }

    @Test
    @DisplayName("should resolve a waiter when the matching entity is created")
    void shouldResolveWaiter() throws Exception {
        CompletableFuture<Event> waiter = bus.waitForEvent("task:created", Duration.ofSeconds(5));

        Task created = service.create("Buy milk");

        Event event = waiter.get(1, TimeUnit.SECONDS);
        assertThat(event.dataAs(Task.class)).isEqualTo(created);
        assertThat(bus.listenerCount("task:created")).isZero();
    }

    @Test
    @DisplayName("should not publish when the store rejects the write")
    void shouldNotPublishRejectedWrite() {
        assertThatThrownBy(() -> service.rename("missing", "x"))
            .isInstanceOf(io.strata.core.error.NotFoundException.class);

        assertThat(bus.getEventHistory()).isEmpty();
    }

    @Test
    @DisplayName("should reap expired entities through the sweeper")
    void shouldSweepExpiredEntities() {
        EntityStore<Task> sessions = EntityStore.builder(Task.class)
            .name("session")
            .clock(clock)
            .defaultTtl(Duration.ofMinutes(1))
            .build();
        sessions.create(Task.draft("a"));
        sessions.create(Task.draft("b"));

        try (ExpirySweeper sweeper = ExpirySweeper.builder().interval(Duration.ofHours(1)).build()) {
            sweeper.register(tasks);
            sweeper.register(sessions);
            clock.advance(Duration.ofMinutes(2));

            assertThat(sweeper.sweep()).isEqualTo(2);
            assertThat(sessions.itemCount()).isZero();
            assertThat(sweeper.getMetrics().totalReleased()).isEqualTo(2);
        }
    }

    /**
     * Minimal service layer publishing one event per successful mutation.
     */
    static final class TaskService {
        private static final String SOURCE = "task-service";

        private final EntityStore<Task> store;
        private final EventBus bus;

        TaskService(EntityStore<Task> store, EventBus bus) {
            this.store = store;
            this.bus = bus;
        }

        Task create(String title) {
            Task created = store.create(Task.draft(title));
            bus.emitSync(Event.of("task:created", SOURCE, created));
            return created;
        }

        Task rename(String id, String title) {
            Task updated = store.update(id, Map.of("title", title));
            bus.emitSync(Event.of("task:updated", SOURCE, updated));
            return updated;
        }

        boolean remove(String id) {
            boolean removed = store.delete(id);
            if (removed) {
                bus.emitSync(Event.of("task:deleted", SOURCE, id));
            }
            return removed;
        }
    }
}
