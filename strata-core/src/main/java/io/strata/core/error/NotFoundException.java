package io.strata.core.error;

/**
 * Raised when an operation requires a resource that does not exist
 * (or has expired).
 *
 * @author Strata Team
 * @since 1.0.0
 */
public class NotFoundException extends StrataException {

    public static final String CODE = "NOT_FOUND";

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(CODE, resource + " '" + id + "' not found");
        this.resource = resource;
        this.id = id;
        addContext("resource", resource);
        addContext("id", id);
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
