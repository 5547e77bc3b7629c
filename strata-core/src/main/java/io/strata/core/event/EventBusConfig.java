package io.strata.core.event;

import java.util.Objects;

/**
 * Immutable configuration for {@link EventBus} instances.
 *
 * <pre>{@code
 * EventBusConfig config = EventBusConfig.builder()
 *     .maxHistorySize(500)
 *     .defaultMode(DeliveryMode.SYNC)
 *     .build();
 * EventBus bus = EventBus.create(config);
 * }</pre>
 *
 * @param maxHistorySize number of events kept for diagnostics, 0 disables history
 * @param defaultMode mode used by {@link EventBus#publish(Event)}
 *
 * @author Strata Team
 * @since 1.0.0
 */
public record EventBusConfig(int maxHistorySize, DeliveryMode defaultMode) {

    /**
     * Default history size: 1000 events.
     */
    public static final int DEFAULT_MAX_HISTORY_SIZE = 1000;

    public EventBusConfig {
        if (maxHistorySize < 0) {
            throw new IllegalArgumentException("maxHistorySize must not be negative");
        }
        Objects.requireNonNull(defaultMode, "defaultMode must not be null");
    }

    /**
     * Creates the default configuration.
     * @return history of 1000 events, asynchronous publish
     */
    public static EventBusConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Creates a new builder for EventBusConfig.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EventBusConfig.
     */
    public static class Builder {
        private int maxHistorySize = DEFAULT_MAX_HISTORY_SIZE;
        private DeliveryMode defaultMode = DeliveryMode.ASYNC;

        public Builder maxHistorySize(int maxHistorySize) {
            this.maxHistorySize = maxHistorySize;
            return this;
        }

        public Builder defaultMode(DeliveryMode defaultMode) {
            this.defaultMode = defaultMode;
            return this;
        }

        public EventBusConfig build() {
            return new EventBusConfig(maxHistorySize, defaultMode);
        }
    }
}
