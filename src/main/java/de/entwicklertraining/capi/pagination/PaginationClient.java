package de.entwicklertraining.capi.pagination;

import de.entwicklertraining.capi.cancellation.CancellationToken;

/**
 * Fetches one page of a list endpoint.
 */
@FunctionalInterface
public interface PaginationClient<T> {

    ListResponse<T> listWithPath(String path, QueryParams params, CancellationToken cancellationToken);
}
