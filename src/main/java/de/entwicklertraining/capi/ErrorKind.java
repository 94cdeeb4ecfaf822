package de.entwicklertraining.capi;

/**
 * Closed set of failure categories raised by the request pipeline.
 * Every {@link ApiClientException} carries exactly one kind so callers can branch
 * without string matching.
 */
public enum ErrorKind {
    AUTHENTICATION("AUTH", "authentication failed"),
    TRANSPORT("TRANSPORT", "transport failure"),
    TIMEOUT("TIMEOUT", "operation timed out"),
    API("API", "API returned an error response"),
    CIRCUIT_OPEN("CIRCUIT_OPEN", "circuit breaker is open"),
    CACHE_DISABLED("CACHE_DISABLED", "cache disabled"),
    CACHE_MISS("CACHE_MISS", "key not found"),
    CACHE_EXPIRED("CACHE_EXPIRED", "entry expired"),
    CACHE_NOT_FOUND_IN_ANY("CACHE_NOT_FOUND_IN_ANY", "key not found in any cache"),
    UNSUPPORTED_CACHE_TYPE("UNSUPPORTED_CACHE_TYPE", "unsupported cache type"),
    INTERCEPTOR("INTERCEPTOR", "interceptor failed"),
    BATCH_OPERATION("BATCH_OPERATION", "batch operation failed"),
    TRANSACTION_FAILED("TRANSACTION_FAILED", "transaction failed");

    private final String code;
    private final String defaultMessage;

    ErrorKind(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
