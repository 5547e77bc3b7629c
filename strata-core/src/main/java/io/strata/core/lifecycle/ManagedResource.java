package io.strata.core.lifecycle;

/**
 * A component holding entries that can expire, reaped by an {@link ExpirySweeper}.
 *
 * <p>Implementors must keep reads correct on their own (expired entries are
 * never observed as live); sweeping only reclaims memory earlier.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public interface ManagedResource {

    /**
     * Returns the unique name of this resource.
     * @return resource name
     */
    String name();

    /**
     * Returns the number of entries currently held, expired ones included.
     * @return item count
     */
    long itemCount();

    /**
     * Removes expired entries, keeping live data.
     * @return number of entries removed
     */
    long releaseExpired();

    /**
     * Returns true if this resource is currently empty.
     * @return true if empty
     */
    default boolean isEmpty() {
        return itemCount() == 0;
    }
}
