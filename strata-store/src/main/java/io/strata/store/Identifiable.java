package io.strata.store;

/**
 * An entity with a store-unique string identifier.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public interface Identifiable {

    /**
     * Returns the identifier, or null for a draft that has not been stored yet.
     * @return entity id
     */
    String id();
}
