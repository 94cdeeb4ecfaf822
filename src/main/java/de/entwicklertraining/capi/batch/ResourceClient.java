package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.cancellation.CancellationToken;

/**
 * Typed CRUD access to one resource kind.
 *
 * @param <C> create request type
 * @param <U> update request type
 * @param <R> resource type
 */
public interface ResourceClient<C, U, R> {

    R create(C request, CancellationToken cancellationToken);

    R update(String guid, U request, CancellationToken cancellationToken);

    /**
     * @return the asynchronous job the deletion started, or {@code null}
     */
    Object delete(String guid, CancellationToken cancellationToken);

    R get(String guid, CancellationToken cancellationToken);
}
