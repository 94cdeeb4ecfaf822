package de.entwicklertraining.capi.pagination;

import java.util.List;

/**
 * One page of a list endpoint.
 */
public record ListResponse<T>(Pagination pagination, List<T> resources) {

    public ListResponse {
        pagination = pagination == null ? Pagination.empty() : pagination;
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
