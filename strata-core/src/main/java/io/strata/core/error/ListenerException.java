package io.strata.core.error;

/**
 * Wraps a failure thrown by an event listener during synchronous delivery.
 *
 * <p>The original failure is available via {@link #getCause()}.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class ListenerException extends StrataException {

    public static final String CODE = "LISTENER_ERROR";

    private final String eventType;

    public ListenerException(String eventType, Throwable cause) {
        super(CODE, "Listener failed for '" + eventType + "': " + cause.getMessage(), cause);
        this.eventType = eventType;
        addContext("eventType", eventType);
    }

    public String getEventType() {
        return eventType;
    }
}
