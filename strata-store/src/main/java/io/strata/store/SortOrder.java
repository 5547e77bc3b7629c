package io.strata.store;

/**
 * Sort direction for paged reads.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public enum SortOrder {
    /** Smallest first, missing values first */
    ASC,
    /** Largest first, missing values last */
    DESC
}
