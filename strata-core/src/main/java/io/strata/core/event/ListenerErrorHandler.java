package io.strata.core.event;

/**
 * Receives listener failures isolated by asynchronous delivery.
 *
 * @author Strata Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ListenerErrorHandler {

    /**
     * Called after a listener threw while handling {@code event}.
     *
     * @param event the event being delivered
     * @param error what the listener threw
     */
    void onError(Event event, Throwable error);
}
