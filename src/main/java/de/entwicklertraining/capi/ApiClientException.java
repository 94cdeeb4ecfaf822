package de.entwicklertraining.capi;

import java.util.Objects;

/**
 * Base type of every failure the pipeline raises on purpose.
 * <p>
 * Subclasses narrow the context (HTTP status, cache key, batch results, ...), while
 * {@link #getKind()} gives the stable category. Cancellation is reported separately through
 * {@link de.entwicklertraining.capi.cancellation.CancellationException}.
 */
public class ApiClientException extends RuntimeException {

    private final ErrorKind kind;

    public ApiClientException(ErrorKind kind) {
        this(kind, kind.getDefaultMessage());
    }

    public ApiClientException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ApiClientException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
