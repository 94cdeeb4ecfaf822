package de.entwicklertraining.capi.pagination;

import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.util.ArrayList;
import java.util.List;

public final class Paginator {

    private Paginator() {
    }

    /**
     * Collects the items of all pages, honoring the page size and page limit of {@code options}.
     */
    public static <T> List<T> fetchAllPages(PaginationClient<T> client, String path, QueryParams params,
                                            PaginationOptions options, CancellationToken cancellationToken) {
        PaginationOptions opts = options == null ? PaginationOptions.defaults() : options;
        QueryParams query = params == null ? new QueryParams() : params.copyWithPage(params.getPage());
        if (opts.pageSize() > 0 && query.getPerPage() == 0) {
            query.withPerPage(opts.pageSize());
        }

        List<T> items = new ArrayList<>();
        int page = query.getPage() > 0 ? query.getPage() : 1;
        int fetched = 0;
        while (true) {
            cancellationToken.throwIfCancelled();
            ListResponse<T> response = client.listWithPath(path, query.copyWithPage(page), cancellationToken);
            items.addAll(response.resources());
            fetched++;
            if (!response.pagination().hasNext() || (opts.maxPages() > 0 && fetched >= opts.maxPages())) {
                return items;
            }
            page = response.pagination().next().queryInt("page").orElse(page + 1);
        }
    }

    public static <T> PaginationIterator<T> iterate(PaginationClient<T> client, String path, QueryParams params,
                                                    CancellationToken cancellationToken) {
        return new PaginationIterator<>(client, path, params, cancellationToken);
    }
}
