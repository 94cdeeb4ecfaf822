package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A batch that, when any operation fails, deletes the resources its successful creates produced.
 * <p>
 * Updates and deletes cannot be reversed; they are reported through
 * {@link TransactionFailedException#getUnreversedIds()}. Rollback deletes run through the same
 * executor and their failures are logged, not rethrown.
 */
public class BatchTransaction {
    private static final Logger logger = LoggerFactory.getLogger(BatchTransaction.class.getName());

    static final String ROLLBACK_PREFIX = "rollback_";

    private final BatchExecutor executor;
    private final List<BatchOperation> operations = new ArrayList<>();
    private boolean rollback = true;

    public BatchTransaction(BatchExecutor executor) {
        this.executor = executor;
    }

    public BatchTransaction add(BatchOperation operation) {
        operations.add(operation);
        return this;
    }

    public BatchTransaction addAll(List<BatchOperation> ops) {
        operations.addAll(ops);
        return this;
    }

    public BatchTransaction setRollback(boolean rollback) {
        this.rollback = rollback;
        return this;
    }

    public boolean isRollback() {
        return rollback;
    }

    /**
     * Runs every operation.
     *
     * @return all results when nothing failed, or when rollback is disabled
     * @throws TransactionFailedException if an operation failed and rollback is enabled
     */
    public List<BatchResult> execute(CancellationToken cancellationToken) {
        List<BatchResult> results = executor.execute(List.copyOf(operations), cancellationToken);

        List<String> failedIds = new ArrayList<>();
        for (BatchResult result : results) {
            if (!result.success()) {
                failedIds.add(result.id());
            }
        }
        if (failedIds.isEmpty() || !rollback) {
            return results;
        }

        logger.warn("Transaction failed for operations {}, rolling back", failedIds);
        List<BatchOperation> compensations = new ArrayList<>();
        List<String> unreversed = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            BatchOperation operation = operations.get(i);
            BatchResult result = results.get(i);
            if (!result.success()) {
                continue;
            }
            Optional<BatchOperation> compensation = compensationFor(operation, result);
            if (compensation.isPresent()) {
                compensations.add(compensation.get());
            } else if (!OperationType.GET.getValue().equals(operation.type())) {
                unreversed.add(operation.id());
            }
        }

        List<BatchResult> rollbackResults = compensations.isEmpty()
                ? List.of()
                : executor.execute(compensations, cancellationToken);
        for (BatchResult rollbackResult : rollbackResults) {
            if (!rollbackResult.success()) {
                logger.warn("Rollback operation {} failed", rollbackResult.id(), rollbackResult.error());
            }
        }
        if (!unreversed.isEmpty()) {
            logger.warn("Operations {} cannot be reversed", unreversed);
        }
        throw new TransactionFailedException(failedIds, results, rollbackResults, unreversed);
    }

    private Optional<BatchOperation> compensationFor(BatchOperation operation, BatchResult result) {
        if (!OperationType.CREATE.getValue().equals(operation.type())) {
            return Optional.empty();
        }
        return executor.getRegistry().find(operation.resource())
                .flatMap(descriptor -> descriptor.guidOf(result.data()))
                .map(guid -> BatchOperation.delete(ROLLBACK_PREFIX + operation.id(), operation.resource(), guid));
    }
}
