package io.strata.core.event;

import io.strata.core.error.ValidationException;

import java.time.Instant;

/**
 * Immutable domain event published on an {@link EventBus}.
 *
 * <p>Events carry a string {@code type} tag used for routing, the moment they
 * were produced, the identity of the producer and an opaque payload.</p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Event created = Event.of("task:created", "task-service", Map.of("taskId", task.id()));
 * bus.emit(created);
 * }</pre>
 *
 * @param type routing tag, e.g. {@code "task:created"}
 * @param timestamp when the event was produced
 * @param source producer identity
 * @param data opaque payload, may be null
 *
 * @author Strata Team
 * @since 1.0.0
 */
public record Event(String type, Instant timestamp, String source, Object data) {

    /** Source used by {@link #of(String, Object)}. */
    public static final String DEFAULT_SOURCE = "anonymous";

    /**
     * Creates an event stamped with the current time.
     *
     * @param type routing tag
     * @param source producer identity
     * @param data payload
     * @return new event
     */
    public static Event of(String type, String source, Object data) {
        return new Event(type, Instant.now(), source, data);
    }

    /**
     * Creates an event from {@link #DEFAULT_SOURCE} stamped with the current time.
     *
     * @param type routing tag
     * @param data payload
     * @return new event
     */
    public static Event of(String type, Object data) {
        return of(type, DEFAULT_SOURCE, data);
    }

    /**
     * Returns the payload cast to the requested type.
     *
     * @param dataType expected payload type
     * @param <D> payload type
     * @return payload, or null if the event carries none
     * @throws ClassCastException if the payload has another type
     */
    public <D> D dataAs(Class<D> dataType) {
        return dataType.cast(data);
    }

    /**
     * Checks that this event can be routed.
     *
     * @return this event
     * @throws ValidationException if type or source is blank, the type is the
     *         wildcard, or the timestamp is missing
     */
    public Event validate() {
        if (type == null || type.isBlank()) {
            throw new ValidationException("type", "required", type);
        }
        if (EventBus.WILDCARD.equals(type)) {
            throw new ValidationException("type", "not-wildcard", type);
        }
        if (timestamp == null) {
            throw new ValidationException("timestamp", "required", null);
        }
        if (source == null || source.isBlank()) {
            throw new ValidationException("source", "required", source);
        }
        return this;
    }
}
