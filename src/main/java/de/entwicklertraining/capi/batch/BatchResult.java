package de.entwicklertraining.capi.batch;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one {@link BatchOperation}.
 *
 * @param id       id of the operation
 * @param success  whether the operation completed without error
 * @param data     what the resource client returned, may be {@code null}
 * @param error    the failure, {@code null} on success
 * @param duration wall time spent on the operation
 */
public record BatchResult(String id, boolean success, Object data, Throwable error, Duration duration) {

    public static BatchResult success(String id, Object data, Duration duration) {
        return new BatchResult(id, true, data, null, duration);
    }

    public static BatchResult failure(String id, Throwable error, Duration duration) {
        return new BatchResult(id, false, null, error, duration);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the data cast to {@code type}, empty if absent or of another type.
     */
    public <T> Optional<T> dataAs(Class<T> type) {
        return type.isInstance(data) ? Optional.of(type.cast(data)) : Optional.empty();
    }
}
