package io.strata.core.error;

/**
 * Raised when a bounded resource has reached its configured maximum size.
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class CapacityException extends StrataException {

    public static final String CODE = "CAPACITY_EXCEEDED";

    private final String resource;
    private final int maxSize;

    public CapacityException(String resource, int maxSize) {
        super(CODE, resource + " is full (maxSize=" + maxSize + ")");
        this.resource = resource;
        this.maxSize = maxSize;
        addContext("resource", resource);
        addContext("maxSize", maxSize);
    }

    public String getResource() {
        return resource;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
