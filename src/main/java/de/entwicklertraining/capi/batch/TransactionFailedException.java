package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

import java.util.List;

/**
 * Thrown by {@link BatchTransaction#execute} when at least one operation failed and rollback was attempted.
 * <p>
 * Carries every result so callers can see what succeeded, the results of the compensating
 * deletes and the ids of successful operations that could not be reversed (updates, deletes
 * and creates whose GUID was unknown).
 */
public class TransactionFailedException extends ApiClientException {

    private final List<String> failedIds;
    private final List<BatchResult> results;
    private final List<BatchResult> rollbackResults;
    private final List<String> unreversedIds;

    public TransactionFailedException(List<String> failedIds, List<BatchResult> results,
                                      List<BatchResult> rollbackResults, List<String> unreversedIds) {
        super(ErrorKind.TRANSACTION_FAILED,
                "transaction failed, " + failedIds.size() + " operations failed: " + failedIds);
        this.failedIds = List.copyOf(failedIds);
        this.results = List.copyOf(results);
        this.rollbackResults = List.copyOf(rollbackResults);
        this.unreversedIds = List.copyOf(unreversedIds);
    }

    public List<String> getFailedIds() {
        return failedIds;
    }

    public List<BatchResult> getResults() {
        return results;
    }

    public List<BatchResult> getRollbackResults() {
        return rollbackResults;
    }

    public List<String> getUnreversedIds() {
        return unreversedIds;
    }
}
