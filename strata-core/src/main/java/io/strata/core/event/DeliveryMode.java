package io.strata.core.event;

/**
 * How {@link EventBus#publish(Event)} delivers an event.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public enum DeliveryMode {
    /** Isolated fan-out on the bus executor, failures are recorded not thrown */
    ASYNC,
    /** Ordered fan-out on the caller thread, the first failure is thrown */
    SYNC
}
