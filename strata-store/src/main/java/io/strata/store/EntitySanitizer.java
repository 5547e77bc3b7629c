package io.strata.store;

/**
 * Normalization strategy (trimming, case folding...) applied before validation.
 *
 * <p>The store restores {@code id}, {@code createdAt} and {@code updatedAt}
 * after sanitizing, so sanitizers cannot alter identity or timestamps.</p>
 *
 * @param <T> entity type
 * @author Strata Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntitySanitizer<T> {

    /**
     * Returns the canonical form of a candidate.
     *
     * @param candidate draft or merged entity
     * @return sanitized entity, never null
     */
    T sanitize(T candidate);

    /**
     * Returns a sanitizer that leaves candidates unchanged.
     * @param <T> entity type
     * @return identity sanitizer
     */
    static <T> EntitySanitizer<T> identity() {
        return candidate -> candidate;
    }
}
