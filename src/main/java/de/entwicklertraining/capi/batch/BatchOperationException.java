package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

/**
 * A batch operation could not be dispatched: unknown resource tag, unknown verb or a payload of the wrong type.
 */
public class BatchOperationException extends ApiClientException {

    public BatchOperationException(String message) {
        super(ErrorKind.BATCH_OPERATION, message);
    }
}
