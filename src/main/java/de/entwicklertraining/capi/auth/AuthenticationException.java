package de.entwicklertraining.capi.auth;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

import java.util.Optional;

/**
 * Raised when no bearer token can be produced: no usable credentials, or the token endpoint
 * refused the grant. For refused grants the OAuth2 {@code error} and {@code error_description}
 * are part of the message and available separately.
 */
public class AuthenticationException extends ApiClientException {

    private final int statusCode;
    private final String error;
    private final String errorDescription;

    public AuthenticationException(String message) {
        this(message, 0, null, null, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        this(message, 0, null, null, cause);
    }

    public AuthenticationException(String message, int statusCode, String error, String errorDescription, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, message, cause);
        this.statusCode = statusCode;
        this.error = error;
        this.errorDescription = errorDescription;
    }

    /**
     * @return HTTP status of the token endpoint, 0 if the endpoint was not reached
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<String> getErrorDescription() {
        return Optional.ofNullable(errorDescription);
    }
}
