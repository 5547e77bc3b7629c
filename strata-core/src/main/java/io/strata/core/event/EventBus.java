package io.strata.core.event;

import io.strata.core.error.EventTimeoutException;
import io.strata.core.error.ListenerException;
import io.strata.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process event bus for pub/sub between decoupled components of the same JVM.
 *
 * <p>Listeners subscribe to a string event type, or to {@link #WILDCARD} to
 * receive every emission. Each emitted event is first appended to a bounded
 * history buffer and then delivered.</p>
 *
 * <h2>Delivery modes</h2>
 * <ul>
 *   <li>{@link #emit(Event)} - every listener runs as its own task on the bus
 *       executor. A failing listener is logged, counted and handed to the
 *       {@link ListenerErrorHandler}; other listeners still run.</li>
 *   <li>{@link #emitSync(Event)} - listeners run on the caller thread in
 *       subscription order. The first failure stops delivery and is thrown as
 *       a {@link ListenerException}.</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EventBus bus = EventBus.builder()
 *     .executor(Executors.newFixedThreadPool(4))
 *     .maxHistorySize(500)
 *     .build();
 *
 * Subscription sub = bus.subscribe("task:created", event -> index.add(event.data()));
 *
 * bus.emit(Event.of("task:created", "task-service", task));
 *
 * sub.unsubscribe();
 * }</pre>
 *
 * <p>Thread-safe.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Event type matching every emission. */
    public static final String WILDCARD = "*";

    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final Deque<Event> history = new ArrayDeque<>();
    private final Set<CompletableFuture<Event>> pendingWaits = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object schedulerLock = new Object();

    private final Executor executor;
    private final int maxHistorySize;
    private final DeliveryMode defaultMode;
    private final ListenerErrorHandler errorHandler;

    // Statistics
    private final LongAdder emitted = new LongAdder();
    private final LongAdder failures = new LongAdder();

    private volatile ScheduledExecutorService timeoutScheduler;

    private EventBus(Builder builder) {
        this.executor = builder.executor;
        this.maxHistorySize = builder.maxHistorySize;
        this.defaultMode = builder.defaultMode;
        this.errorHandler = builder.errorHandler;
    }

    /**
     * Creates an event bus that delivers on the emitting thread.
     * @return new event bus with default configuration
     */
    public static EventBus create() {
        return builder().build();
    }

    /**
     * Creates an event bus with custom async executor.
     *
     * @param executor executor for asynchronous delivery
     * @return new event bus
     */
    public static EventBus create(Executor executor) {
        return builder().executor(executor).build();
    }

    /**
     * Creates an event bus from a configuration record.
     *
     * @param config history and mode settings
     * @return new event bus
     */
    public static EventBus create(EventBusConfig config) {
        return builder().config(config).build();
    }

    /**
     * Creates a new builder for EventBus.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @param eventType the event type, or {@link #WILDCARD}
     * @param listener the listener to call when a matching event is emitted
     * @return subscription that removes exactly this registration
     */
    public Subscription subscribe(String eventType, EventListener listener) {
        requireEventType(eventType);
        Objects.requireNonNull(listener, "listener must not be null");

        Registration registration = new Registration(eventType, listener, sequence.incrementAndGet());
        listeners.compute(eventType, (type, list) -> {
            List<Registration> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(registration);
            return target;
        });
        log.debug("[STRATA] Listener subscribed to '{}'", eventType);
        return registration;
    }

    /**
     * Removes every listener registered for the event type.
     *
     * @param eventType the event type
     * @return number of listeners removed, 0 if none existed
     */
    public int unsubscribeAll(String eventType) {
        List<Registration> removed = listeners.remove(eventType);
        if (removed == null) {
            return 0;
        }
        int count = 0;
        for (Registration registration : removed) {
            if (registration.active.compareAndSet(true, false)) {
                count++;
            }
        }
        log.debug("[STRATA] Removed {} listeners from '{}'", count, eventType);
        return count;
    }

    /**
     * Emits an event with isolated, possibly asynchronous delivery.
     *
     * <p>The returned future completes normally once every listener has run,
     * whether or not it failed, even with an {@link Error}.</p>
     *
     * @param event the event to emit
     * @return completion of the fan-out
     * @throws ValidationException if the event is malformed
     */
    public CompletableFuture<Void> emit(Event event) {
        accept(event);

        List<Registration> targets = matching(event.type());
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?>[] deliveries = new CompletableFuture<?>[targets.size()];
        for (int i = 0; i < targets.size(); i++) {
            Registration registration = targets.get(i);
            try {
                deliveries[i] = CompletableFuture.runAsync(() -> deliverIsolated(registration, event), executor);
            } catch (RejectedExecutionException e) {
                handleListenerError(registration, event, e);
                deliveries[i] = CompletableFuture.completedFuture(null);
            }
        }
        return CompletableFuture.allOf(deliveries);
    }

    /**
     * Emits an event on the caller thread, in subscription order.
     *
     * <p>Returns only after every listener has run. Delivery stops at the first
     * failing listener.</p>
     *
     * @param event the event to emit
     * @throws ValidationException if the event is malformed
     * @throws ListenerException if a listener throws
     */
    public void emitSync(Event event) {
        accept(event);

        for (Registration registration : matching(event.type())) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
            } catch (Exception e) {
                failures.increment();
                log.warn("[STRATA] Listener for '{}' failed during sync delivery: {}", event.type(), e.getMessage());
                throw new ListenerException(event.type(), e);
            }
        }
    }

    /**
     * Emits an event using the configured default mode.
     *
     * @param event the event to emit
     * @return completion of the fan-out, already complete in SYNC mode
     */
    public CompletableFuture<Void> publish(Event event) {
        if (defaultMode == DeliveryMode.SYNC) {
            emitSync(event);
            return CompletableFuture.completedFuture(null);
        }
        return emit(event);
    }

    /**
     * Emits several events, each with the isolation of {@link #emit(Event)}.
     *
     * <p>A malformed event is logged and skipped, the rest are still emitted.</p>
     *
     * @param events events to emit, in order
     * @return completion of every fan-out
     */
    public CompletableFuture<Void> emitBatch(List<Event> events) {
        Objects.requireNonNull(events, "events must not be null");

        List<CompletableFuture<Void>> deliveries = new ArrayList<>(events.size());
        for (Event event : events) {
            try {
                deliveries.add(emit(event));
            } catch (ValidationException e) {
                failures.increment();
                log.warn("[STRATA] Skipping invalid event in batch: {}", e.getMessage());
            }
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Waits for the next event of the given type.
     *
     * <p>The returned future completes with the first matching event emitted
     * after this call. If none arrives within {@code timeout} it completes
     * exceptionally with {@link EventTimeoutException}. Either way, and also
     * when the caller cancels the future, the internal subscription is
     * removed.</p>
     *
     * @param eventType the event type, or {@link #WILDCARD}
     * @param timeout hard cap on the wait
     * @return future of the matching event
     */
    public CompletableFuture<Event> waitForEvent(String eventType, Duration timeout) {
        requireEventType(eventType);
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        CompletableFuture<Event> result = new CompletableFuture<>();
        Subscription subscription;
        ScheduledFuture<?> timer;
        // close() flips the flag and stops the scheduler under the same lock
        synchronized (schedulerLock) {
            if (closed.get()) {
                throw new IllegalStateException("EventBus is closed");
            }
            pendingWaits.add(result);
            subscription = subscribe(eventType, result::complete);
            try {
                timer = scheduler().schedule(
                        () -> result.completeExceptionally(new EventTimeoutException(eventType, timeout)),
                        timeout.toMillis(),
                        TimeUnit.MILLISECONDS
                );
            } catch (RejectedExecutionException e) {
                subscription.unsubscribe();
                pendingWaits.remove(result);
                throw new IllegalStateException("EventBus cannot schedule wait timeouts", e);
            }
        }
        result.whenComplete((event, error) -> {
            subscription.unsubscribe();
            timer.cancel(false);
            pendingWaits.remove(result);
        });
        return result;
    }

    /**
     * Returns a copy of the whole retained history, oldest first.
     * @return history snapshot
     */
    public List<Event> getEventHistory() {
        return getEventHistory(null, Integer.MAX_VALUE);
    }

    /**
     * Returns the retained events of one type, oldest first.
     *
     * @param eventType type filter, null or {@link #WILDCARD} for all
     * @return history snapshot
     */
    public List<Event> getEventHistory(String eventType) {
        return getEventHistory(eventType, Integer.MAX_VALUE);
    }

    /**
     * Returns at most {@code limit} of the most recent retained events of one
     * type, oldest first.
     *
     * @param eventType type filter, null or {@link #WILDCARD} for all
     * @param limit maximum number of events returned
     * @return history snapshot
     */
    public List<Event> getEventHistory(String eventType, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        boolean all = eventType == null || WILDCARD.equals(eventType);
        List<Event> matches = new ArrayList<>();
        synchronized (history) {
            for (Event event : history) {
                if (all || eventType.equals(event.type())) {
                    matches.add(event);
                }
            }
        }
        if (matches.size() > limit) {
            return new ArrayList<>(matches.subList(matches.size() - limit, matches.size()));
        }
        return matches;
    }

    /**
     * Drops all retained history.
     */
    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    /**
     * Returns the number of listeners per event type, sorted by type.
     * @return listener statistics
     */
    public List<ListenerStat> getListenerStats() {
        List<ListenerStat> stats = new ArrayList<>();
        listeners.forEach((type, list) -> {
            if (!list.isEmpty()) {
                stats.add(new ListenerStat(type, list.size()));
            }
        });
        stats.sort(Comparator.comparing(ListenerStat::eventType));
        return stats;
    }

    /**
     * Returns the number of listeners for a specific event type.
     *
     * @param eventType the event type
     * @return number of registered listeners
     */
    public int listenerCount(String eventType) {
        List<Registration> list = listeners.get(eventType);
        return list != null ? list.size() : 0;
    }

    /**
     * Returns the number of events accepted for delivery.
     * @return emitted count
     */
    public long emittedCount() {
        return emitted.sum();
    }

    /**
     * Returns the number of listener failures and skipped batch events.
     * @return failure count
     */
    public long failureCount() {
        return failures.sum();
    }

    /**
     * Returns the configured history capacity.
     * @return max history size
     */
    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    /**
     * Returns the mode used by {@link #publish(Event)}.
     * @return default delivery mode
     */
    public DeliveryMode getDefaultMode() {
        return defaultMode;
    }

    /**
     * Removes all listeners, cancels pending waits and stops the timeout scheduler.
     */
    @Override
    public void close() {
        synchronized (schedulerLock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (timeoutScheduler != null) {
                timeoutScheduler.shutdownNow();
            }
        }
        for (CompletableFuture<Event> wait : List.copyOf(pendingWaits)) {
            wait.cancel(false);
        }
        for (String type : List.copyOf(listeners.keySet())) {
            unsubscribeAll(type);
        }
        log.info("[STRATA] EventBus closed after {} events", emitted.sum());
    }

    private void accept(Event event) {
        if (event == null) {
            throw new ValidationException("event", "required", null);
        }
        event.validate();
        emitted.increment();
        if (maxHistorySize == 0) {
            return;
        }
        synchronized (history) {
            while (history.size() >= maxHistorySize) {
                history.pollFirst();
            }
            history.addLast(event);
        }
    }

    /**
     * Type-specific and wildcard registrations merged in subscription order.
     */
    private List<Registration> matching(String eventType) {
        List<Registration> targets = new ArrayList<>(listeners.getOrDefault(eventType, List.of()));
        List<Registration> wildcard = listeners.get(WILDCARD);
        if (wildcard != null && !wildcard.isEmpty()) {
            targets.addAll(wildcard);
            targets.sort(Comparator.comparingLong(registration -> registration.sequence));
        }
        return targets;
    }

    private void deliverIsolated(Registration registration, Event event) {
        if (!registration.isActive()) {
            return;
        }
        try {
            registration.listener.onEvent(event);
        } catch (Throwable e) {
            handleListenerError(registration, event, e);
        }
    }

    private void handleListenerError(Registration registration, Event event, Throwable error) {
        failures.increment();
        log.warn("[STRATA] Listener on '{}' failed for '{}' event from {}: {}",
                registration.eventType, event.type(), event.source(), error.getMessage());
        try {
            errorHandler.onError(event, error);
        } catch (Throwable handlerError) {
            log.error("[STRATA] Listener error handler failed", handlerError);
        }
    }

    private void remove(Registration registration) {
        listeners.computeIfPresent(registration.eventType, (type, list) -> {
            list.remove(registration);
            return list.isEmpty() ? null : list;
        });
        log.debug("[STRATA] Listener unsubscribed from '{}'", registration.eventType);
    }

    private ScheduledExecutorService scheduler() {
        ScheduledExecutorService current = timeoutScheduler;
        if (current != null) {
            return current;
        }
        synchronized (schedulerLock) {
            if (timeoutScheduler == null) {
                timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "strata-event-timeouts");
                    t.setDaemon(true);
                    return t;
                });
            }
            return timeoutScheduler;
        }
    }

    private static void requireEventType(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
    }

    /**
     * Subscription handle for unsubscribing.
     */
    public interface Subscription {
        /**
         * Removes the registration. Calling it again has no effect.
         */
        void unsubscribe();

        /**
         * Returns true while the registration can still receive events.
         * @return true if active
         */
        boolean isActive();
    }

    /**
     * Number of listeners registered for one event type.
     */
    public record ListenerStat(String eventType, int count) {}

    private final class Registration implements Subscription {
        private final String eventType;
        private final EventListener listener;
        private final long sequence;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(String eventType, EventListener listener, long sequence) {
            this.eventType = eventType;
            this.listener = listener;
            this.sequence = sequence;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }

    /**
     * Builder for EventBus.
     */
    public static class Builder {
        private Executor executor = Runnable::run;
        private int maxHistorySize = EventBusConfig.DEFAULT_MAX_HISTORY_SIZE;
        private DeliveryMode defaultMode = DeliveryMode.ASYNC;
        private ListenerErrorHandler errorHandler = (event, error) -> { };

        /**
         * Sets the executor used by {@link EventBus#emit(Event)}.
         * Defaults to running listeners on the emitting thread.
         * @param executor delivery executor
         * @return this builder
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public Builder maxHistorySize(int maxHistorySize) {
            if (maxHistorySize < 0) {
                throw new IllegalArgumentException("maxHistorySize must not be negative");
            }
            this.maxHistorySize = maxHistorySize;
            return this;
        }

        public Builder defaultMode(DeliveryMode defaultMode) {
            this.defaultMode = Objects.requireNonNull(defaultMode, "defaultMode must not be null");
            return this;
        }

        /**
         * Sets the callback receiving failures isolated by asynchronous delivery.
         * Failures are logged regardless.
         * @param errorHandler failure callback
         * @return this builder
         */
        public Builder errorHandler(ListenerErrorHandler errorHandler) {
            this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler must not be null");
            return this;
        }

        public Builder config(EventBusConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            this.maxHistorySize = config.maxHistorySize();
            this.defaultMode = config.defaultMode();
            return this;
        }

        public EventBus build() {
            return new EventBus(this);
        }
    }
}
