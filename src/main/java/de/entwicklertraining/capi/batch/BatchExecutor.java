package de.entwicklertraining.capi.batch;

import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs batches of {@link BatchOperation}s concurrently.
 * <p>
 * At most {@code concurrency} operations are in flight; a permit is taken before a worker is
 * dispatched, so submission blocks while the limit is reached. Every operation runs under its own
 * deadline derived from the caller's token. Results come back in submission order and each
 * operation's callback fires exactly once, after its result is stored.
 */
public class BatchExecutor {
    private static final Logger logger = LoggerFactory.getLogger(BatchExecutor.class.getName());

    public static final int DEFAULT_CONCURRENCY = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final long PERMIT_POLL_MS = 50;

    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "capi-batch-" + WorkerCounter.NEXT.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final ResourceRegistry registry;
    private final int concurrency;
    private volatile Duration timeout = DEFAULT_TIMEOUT;

    public BatchExecutor(ResourceRegistry registry) {
        this(registry, DEFAULT_CONCURRENCY);
    }

    /**
     * @param concurrency maximum number of operations in flight, values below 1 mean the default
     */
    public BatchExecutor(ResourceRegistry registry, int concurrency) {
        this.registry = registry;
        this.concurrency = concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Sets the per-operation timeout.
     */
    public void setTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    public ResourceRegistry getRegistry() {
        return registry;
    }

    /**
     * Executes all operations and returns once every one has completed.
     * <p>
     * Operation failures never abort the batch; they show up as unsuccessful results. If the
     * token is cancelled while waiting for a permit, the remaining operations are completed with
     * a {@link CancellationException} without being dispatched.
     *
     * @return one result per operation, in input order
     */
    public List<BatchResult> execute(List<BatchOperation> operations, CancellationToken cancellationToken) {
        BatchResult[] results = new BatchResult[operations.size()];
        if (operations.isEmpty()) {
            return List.of();
        }
        logger.debug("Executing batch of {} operations with concurrency {}", operations.size(), concurrency);

        Semaphore permits = new Semaphore(concurrency);
        CountDownLatch done = new CountDownLatch(operations.size());

        for (int i = 0; i < operations.size(); i++) {
            BatchOperation operation = operations.get(i);
            int index = i;
            if (!acquire(permits, cancellationToken)) {
                complete(operation, results, index,
                        BatchResult.failure(operation.id(), new CancellationException("batch cancelled before dispatch"), Duration.ZERO));
                done.countDown();
                continue;
            }
            WORKERS.execute(() -> {
                try {
                    complete(operation, results, index, run(operation, cancellationToken));
                } finally {
                    permits.release();
                    done.countDown();
                }
            });
        }

        awaitAll(done);
        return Arrays.asList(results);
    }

    private BatchResult run(BatchOperation operation, CancellationToken parent) {
        CancellationToken token = parent.withTimeoutLinked(timeout);
        long start = System.nanoTime();
        try {
            token.throwIfCancelled();
            Optional<OperationType> type = OperationType.fromValue(operation.type());
            ResourceDescriptor<?, ?, ?> descriptor = registry.require(operation.resource());
            if (type.isEmpty()) {
                throw new BatchOperationException("unsupported operation type: " + operation.type());
            }
            Object data = descriptor.execute(type.get(), operation.data(), token);
            return BatchResult.success(operation.id(), data, elapsedSince(start));
        } catch (RuntimeException e) {
            logger.debug("Batch operation {} failed: {}", operation.id(), e.getMessage());
            return BatchResult.failure(operation.id(), e, elapsedSince(start));
        }
    }

    private static void complete(BatchOperation operation, BatchResult[] results, int index, BatchResult result) {
        results[index] = result;
        if (operation.callback() != null) {
            try {
                operation.callback().accept(result);
            } catch (RuntimeException e) {
                logger.warn("Callback of batch operation {} failed", operation.id(), e);
            }
        }
    }

    private static boolean acquire(Semaphore permits, CancellationToken cancellationToken) {
        try {
            while (!cancellationToken.isCancelled()) {
                if (permits.tryAcquire(PERMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void awaitAll(CountDownLatch done) {
        boolean interrupted = false;
        while (true) {
            try {
                done.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(1, System.nanoTime() - startNanos));
    }

    private static final class WorkerCounter {
        static final AtomicInteger NEXT = new AtomicInteger();
    }
}
