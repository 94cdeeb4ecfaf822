package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

/**
 * Wraps an unexpected failure thrown by an interceptor.
 */
public class InterceptorException extends ApiClientException {

    public InterceptorException(String message, Throwable cause) {
        super(ErrorKind.INTERCEPTOR, message, cause);
    }
}
