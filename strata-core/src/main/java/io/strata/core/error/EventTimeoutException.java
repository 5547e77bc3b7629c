package io.strata.core.error;

import java.time.Duration;

/**
 * Raised when no matching event arrived before a wait's deadline.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class EventTimeoutException extends StrataException {

    public static final String CODE = "TIMEOUT";

    private final String eventType;
    private final Duration timeout;

    public EventTimeoutException(String eventType, Duration timeout) {
        super(CODE, "No '" + eventType + "' event within " + timeout.toMillis() + "ms");
        this.eventType = eventType;
        this.timeout = timeout;
        addContext("eventType", eventType);
        addContext("timeoutMs", timeout.toMillis());
    }

    public String getEventType() {
        return eventType;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
