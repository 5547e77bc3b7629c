package io.strata.store;

import java.time.Instant;

/**
 * An entity carrying creation and last-modification timestamps.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public interface Timestamped {

    /**
     * Returns when the entity was first stored, or null for a draft.
     * @return creation time
     */
    Instant createdAt();

    /**
     * Returns when the entity was last successfully mutated, or null for a draft.
     * @return last update time
     */
    Instant updatedAt();
}
