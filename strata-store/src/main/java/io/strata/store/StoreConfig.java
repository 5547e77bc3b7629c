package io.strata.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for {@link EntityStore} instances.
 *
 * <p>Use the builder pattern for fluent configuration:</p>
 * <pre>{@code
 * StoreConfig config = StoreConfig.builder()
 *     .name("sessions")
 *     .defaultTtl(Duration.ofMinutes(30))
 *     .maxSize(10_000)
 *     .build();
 * }</pre>
 *
 * @param name store name used in errors, logs and sweeper registration
 * @param defaultTtl lifespan applied to entities created without an explicit ttl, null for none
 * @param maxSize hard cap on live entities, 0 for unbounded
 * @param recordStats whether read and mutation counters are maintained
 *
 * @author Strata Team
 * @since 1.0.0
 */
public record StoreConfig(
        String name,
        Duration defaultTtl,
        int maxSize,
        boolean recordStats
) {

    /**
     * Unbounded max size.
     */
    public static final int UNBOUNDED = 0;

    public StoreConfig {
        Objects.requireNonNull(name, "name must not be null");
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative");
        }
        if (defaultTtl != null && (defaultTtl.isNegative() || defaultTtl.isZero())) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
    }

    /**
     * Creates a new builder for StoreConfig.
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration with the given name.
     * @param name the store name
     * @return no ttl, unbounded, stats on
     */
    public static StoreConfig defaultConfig(String name) {
        return builder().name(name).build();
    }

    /**
     * Builder for StoreConfig.
     */
    public static class Builder {
        private String name = "entity";
        private Duration defaultTtl = null;
        private int maxSize = UNBOUNDED;
        private boolean recordStats = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public StoreConfig build() {
            return new StoreConfig(name, defaultTtl, maxSize, recordStats);
        }
    }
}
