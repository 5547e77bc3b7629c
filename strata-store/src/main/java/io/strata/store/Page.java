package io.strata.store;

import java.util.List;

/**
 * One page of entities plus pagination metadata.
 *
 * @param items entities of this page, possibly empty
 * @param totalItems number of live entities across all pages
 * @param totalPages {@code ceil(totalItems / pageSize)}, 0 when there are no items
 * @param currentPage 1-based number of this page
 * @param hasNext true if a later page holds items
 * @param hasPrev true if this is not the first page
 * @param <T> entity type
 *
 * @author Strata Team
 * @since 1.0.0
 */
public record Page<T>(
        List<T> items,
        int totalItems,
        int totalPages,
        int currentPage,
        boolean hasNext,
        boolean hasPrev
) {

    public Page {
        items = List.copyOf(items);
    }

    /**
     * Slices a sorted snapshot according to a request.
     *
     * @param sorted every matching entity, in final order
     * @param request requested page
     * @param <T> entity type
     * @return the requested page
     */
    static <T> Page<T> slice(List<T> sorted, PageRequest request) {
        int total = sorted.size();
        int pageSize = request.pageSize();
        int totalPages = (int) ((total + (long) pageSize - 1) / pageSize);
        long from = request.offset();

        List<T> items = from >= total
                ? List.of()
                : sorted.subList((int) from, (int) Math.min(from + pageSize, total));

        return new Page<>(
                items,
                total,
                totalPages,
                request.page(),
                request.page() < totalPages,
                request.page() > 1
        );
    }

    /**
     * Wraps a whole snapshot as a single first page.
     *
     * @param all every matching entity
     * @param <T> entity type
     * @return single page
     */
    static <T> Page<T> single(List<T> all) {
        return new Page<>(all, all.size(), all.isEmpty() ? 0 : 1, 1, false, false);
    }

    /**
     * Returns the number of items on this page.
     * @return item count
     */
    public int size() {
        return items.size();
    }

    /**
     * Returns true if this page holds no items.
     * @return true if empty
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }
}
