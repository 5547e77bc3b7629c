package io.strata.store;

/**
 * Validation strategy run by {@link EntityStore} before a mutation is committed.
 *
 * <p>Returning {@code false} makes the store fail the mutation with a generic
 * {@link io.strata.core.error.ValidationException}. Implementations may throw
 * a {@code ValidationException} themselves to name the offending field.</p>
 *
 * @param <T> entity type
 * @author Strata Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntityValidator<T> {

    /**
     * Checks a fully stamped candidate.
     *
     * @param candidate entity about to be stored
     * @return true if the candidate may be stored
     */
    boolean validate(T candidate);

    /**
     * Returns a validator accepting every candidate.
     * @param <T> entity type
     * @return accept-all validator
     */
    static <T> EntityValidator<T> acceptAll() {
        return candidate -> true;
    }

    /**
     * Returns a validator passing only if both this and {@code other} pass.
     * @param other validator to run second
     * @return combined validator
     */
    default EntityValidator<T> and(EntityValidator<T> other) {
        return candidate -> validate(candidate) && other.validate(candidate);
    }
}
