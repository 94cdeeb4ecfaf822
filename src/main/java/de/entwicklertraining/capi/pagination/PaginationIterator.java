package de.entwicklertraining.capi.pagination;

import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Lazily walks a paginated list, fetching the next page only when the buffered items are used up.
 * <p>
 * Fetch failures surface from {@link #hasNext()} and {@link #next()} as the client threw them.
 */
public class PaginationIterator<T> implements Iterator<T> {

    private final PaginationClient<T> client;
    private final String path;
    private final QueryParams params;
    private final CancellationToken cancellationToken;

    private List<T> buffer = List.of();
    private int position;
    private int nextPage;
    private boolean exhausted;
    private int pagesFetched;

    public PaginationIterator(PaginationClient<T> client, String path, QueryParams params,
                              CancellationToken cancellationToken) {
        this.client = client;
        this.path = path;
        this.params = params == null ? new QueryParams() : params;
        this.cancellationToken = cancellationToken;
        this.nextPage = this.params.getPage() > 0 ? this.params.getPage() : 1;
    }

    @Override
    public boolean hasNext() {
        while (position >= buffer.size()) {
            if (exhausted) {
                return false;
            }
            fetch();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more items");
        }
        return buffer.get(position++);
    }

    /**
     * Drains the remaining items into a list.
     */
    public List<T> all() {
        List<T> items = new ArrayList<>();
        while (hasNext()) {
            items.add(next());
        }
        return items;
    }

    /**
     * Same as {@link #forEachRemaining}.
     */
    public void forEach(Consumer<? super T> action) {
        forEachRemaining(action);
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    private void fetch() {
        cancellationToken.throwIfCancelled();
        ListResponse<T> page = client.listWithPath(path, params.copyWithPage(nextPage), cancellationToken);
        pagesFetched++;
        buffer = page.resources();
        position = 0;
        Pagination pagination = page.pagination();
        if (pagination.hasNext()) {
            nextPage = pagination.next().queryInt("page").orElse(nextPage + 1);
        } else {
            exhausted = true;
        }
    }
}
