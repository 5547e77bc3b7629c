package io.strata.core.error;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Base class for every failure raised by STRATA components.
 *
 * <p>Each subclass carries a stable {@link #code()} so callers can classify
 * failures without {@code instanceof} chains, e.g. when mapping them to an
 * HTTP status in a service layer.</p>
 *
 * <h2>Codes</h2>
 * <ul>
 *   <li>{@code VALIDATION_ERROR} - {@link ValidationException}</li>
 *   <li>{@code NOT_FOUND} - {@link NotFoundException}</li>
 *   <li>{@code CAPACITY_EXCEEDED} - {@link CapacityException}</li>
 *   <li>{@code TIMEOUT} - {@link EventTimeoutException}</li>
 *   <li>{@code LISTENER_ERROR} - {@link ListenerException}</li>
 * </ul>
 *
 * <p>Besides the code, every failure records when it was raised and a small
 * context map of the values that describe it. {@link #toMap()} renders all of
 * that, plus the cause chain, as plain values ready for a JSON encoder.</p>
 *
 * @author Strata Team
 * @since 1.0.0
 */
public abstract class StrataException extends RuntimeException {

    private final String code;
    private final Instant timestamp;
    private final transient Map<String, Object> context = new LinkedHashMap<>();

    protected StrataException(String code, String message) {
        super(message);
        this.code = code;
        this.timestamp = Instant.now();
    }

    protected StrataException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.timestamp = Instant.now();
    }

    /**
     * Returns the machine-readable error code.
     * @return error code, never null
     */
    public String code() {
        return code;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns the values describing this failure, in insertion order.
     * @return read-only view of the context
     */
    public Map<String, Object> context() {
        // context is transient, a deserialized instance has none
        return context == null ? Map.of() : Collections.unmodifiableMap(context);
    }

    /**
     * Attaches an extra context entry, overwriting any previous value for the key.
     *
     * @param key   context key
     * @param value context value, may be null
     * @return this exception, for chaining before {@code throw}
     */
    public StrataException withContext(String key, Object value) {
        addContext(key, value);
        return this;
    }

    protected final void addContext(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("context key must not be blank");
        }
        if (context != null) {
            context.put(key, value);
        }
    }

    /**
     * Renders this failure as nested maps, lists and strings.
     *
     * <p>Keys: {@code name}, {@code code}, {@code message}, {@code timestamp}
     * (ISO-8601), {@code context} and {@code causes}, the latter listing
     * every cause below this exception as {@code "SimpleName: message"}.</p>
     *
     * @return a new mutable map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", getClass().getSimpleName());
        view.put("code", code);
        view.put("message", getMessage());
        view.put("timestamp", timestamp.toString());
        view.put("context", new LinkedHashMap<>(context()));
        List<String> causes = new ArrayList<>();
        List<Throwable> chain = causeChain(this);
        for (Throwable cause : chain.subList(1, chain.size())) {
            causes.add(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        view.put("causes", causes);
        return view;
    }

    /**
     * Walks {@code error} and its causes, outermost first.
     * A cause that was already visited ends the walk.
     *
     * @param error starting throwable, may be null
     * @return the chain, empty for null
     */
    public static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            chain.add(current);
        }
        return chain;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
