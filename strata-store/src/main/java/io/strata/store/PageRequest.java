package io.strata.store;

import io.strata.core.error.ValidationException;

/**
 * Paging and sorting parameters for {@link EntityStore#findAll(PageRequest)}.
 *
 * <pre>{@code
 * Page<Task> second = store.findAll(PageRequest.of(2, 10).sortedBy("priority", SortOrder.DESC));
 * }</pre>
 *
 * @param page 1-based page number
 * @param pageSize number of items per page
 * @param sortBy entity property to sort on, or null to keep insertion order
 * @param sortOrder sort direction, defaults to {@link SortOrder#ASC}
 *
 * @author Strata Team
 * @since 1.0.0
 */
public record PageRequest(int page, int pageSize, String sortBy, SortOrder sortOrder) {

    public PageRequest {
        if (page < 1) {
            throw new ValidationException("page", "min:1", page);
        }
        if (pageSize < 1) {
            throw new ValidationException("pageSize", "min:1", pageSize);
        }
        if (sortOrder == null) {
            sortOrder = SortOrder.ASC;
        }
    }

    /**
     * Creates an unsorted page request.
     *
     * @param page 1-based page number
     * @param pageSize items per page
     * @return page request
     */
    public static PageRequest of(int page, int pageSize) {
        return new PageRequest(page, pageSize, null, SortOrder.ASC);
    }

    /**
     * Returns a copy of this request sorted on a property.
     *
     * @param property entity property name
     * @param order sort direction
     * @return sorted page request
     */
    public PageRequest sortedBy(String property, SortOrder order) {
        return new PageRequest(page, pageSize, property, order);
    }

    /**
     * Returns the zero-based index of the first item of this page.
     * @return item offset
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
