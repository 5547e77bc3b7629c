package io.strata.core.event;

/**
 * Callback invoked for each event delivered to a subscription.
 *
 * <p>Listeners may throw. During {@link EventBus#emit(Event)} the failure is
 * isolated; during {@link EventBus#emitSync(Event)} it aborts delivery and
 * reaches the emitter.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventListener {

    /**
     * Handles a delivered event.
     *
     * @param event the event
     * @throws Exception if handling fails
     */
    void onEvent(Event event) throws Exception;
}
