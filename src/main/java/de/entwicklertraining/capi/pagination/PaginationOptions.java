package de.entwicklertraining.capi.pagination;

/**
 * Limits for {@link Paginator#fetchAllPages}.
 *
 * @param pageSize items per page, 0 leaves {@code per_page} to the server
 * @param maxPages pages to fetch at most, 0 means unlimited
 */
public record PaginationOptions(int pageSize, int maxPages) {

    public static final int DEFAULT_PAGE_SIZE = 50;

    public static PaginationOptions defaults() {
        return new PaginationOptions(DEFAULT_PAGE_SIZE, 0);
    }
}
