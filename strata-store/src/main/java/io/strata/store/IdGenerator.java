package io.strata.store;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of candidate entity ids.
 *
 * <p>Generators need not guarantee uniqueness on their own: the store checks
 * every candidate against its current key set and asks again on collision.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Returns a candidate id.
     * @return non-blank id
     */
    String nextId();

    /**
     * Returns a generator of random UUIDs.
     * @return UUID generator
     */
    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }

    /**
     * Returns a generator of {@code prefix-counter-suffix} ids, where the
     * counter increases monotonically and the suffix is random.
     *
     * @param prefix id prefix, e.g. {@code "task"}
     * @return sequential generator
     */
    static IdGenerator sequential(String prefix) {
        AtomicLong counter = new AtomicLong();
        return () -> prefix + "-" + counter.incrementAndGet() + "-"
                + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36);
    }
}
