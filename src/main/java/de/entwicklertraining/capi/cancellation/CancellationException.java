package de.entwicklertraining.capi.cancellation;

/**
 * Thrown when a blocking pipeline operation observes that its {@link CancellationToken}
 * has been cancelled or its deadline has passed.
 */
public class CancellationException extends RuntimeException {

    public CancellationException(String message) {
        super(message);
    }

    public CancellationException(String message, Throwable cause) {
        super(message, cause);
    }
}
