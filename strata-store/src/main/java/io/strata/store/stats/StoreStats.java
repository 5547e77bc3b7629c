package io.strata.store.stats;

/**
 * Interface for entity store statistics reporting.
 *
 * <p>Implementations should use thread-safe counters (e.g., LongAdder).</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * StoreStats stats = store.stats();
 * log.info("{}", stats.snapshot());
 * }</pre>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public interface StoreStats {

    /**
     * Returns the number of id lookups that found a live entity.
     * @return total hit count since creation or last reset
     */
    long hitCount();

    /**
     * Returns the number of id lookups that found nothing live.
     * @return total miss count since creation or last reset
     */
    long missCount();

    /**
     * Returns the total number of id lookups (hits + misses).
     * @return total request count
     */
    default long requestCount() {
        return hitCount() + missCount();
    }

    /**
     * Returns the lookup hit rate as a ratio between 0.0 and 1.0.
     * @return hit rate, or 0.0 if no lookups have been made
     */
    default double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount() / requests;
    }

    /**
     * Returns the current number of live entities.
     * @return store size
     */
    long size();

    /**
     * Returns the number of entities removed because their ttl elapsed.
     * @return expiration count
     */
    long expirationCount();

    long createCount();

    long updateCount();

    long deleteCount();

    /**
     * Resets all counters to zero.
     */
    void reset();

    /**
     * Returns a snapshot of the current statistics.
     * @return immutable stats snapshot
     */
    default StatsSnapshot snapshot() {
        return new StatsSnapshot(hitCount(), missCount(), size(), expirationCount(),
                createCount(), updateCount(), deleteCount());
    }

    /**
     * Immutable snapshot of store statistics at a point in time.
     */
    record StatsSnapshot(
            long hits,
            long misses,
            long size,
            long expirations,
            long creates,
            long updates,
            long deletes
    ) {
        public long requests() {
            return hits + misses;
        }

        public double hitRate() {
            long req = requests();
            return req == 0 ? 0.0 : (double) hits / req;
        }

        @Override
        public String toString() {
            return String.format("StoreStats[size=%d, hits=%d, misses=%d, hitRate=%.2f%%, creates=%d, updates=%d, deletes=%d, expirations=%d]",
                    size, hits, misses, hitRate() * 100, creates, updates, deletes, expirations);
        }
    }
}
