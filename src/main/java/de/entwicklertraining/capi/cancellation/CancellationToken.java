package de.entwicklertraining.capi.cancellation;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Cooperative cancellation signal passed into every blocking call of the pipeline.
 * <p>
 * A token is cancelled when any of the following holds:
 * <ul>
 *   <li>{@link #cancel()} was called (directly or through its {@link CancellationTokenSource})</li>
 *   <li>its deadline has passed</li>
 *   <li>its parent token is cancelled</li>
 *   <li>the external supplier it was created from reports {@code true}</li>
 * </ul>
 * Tokens are polled; nothing runs in the background to fire them.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, null, () -> false, false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CancellationToken parent;
    private final Instant deadline;
    private final Supplier<Boolean> externalSignal;
    private final boolean cancellable;

    CancellationToken(CancellationToken parent, Instant deadline, Supplier<Boolean> externalSignal, boolean cancellable) {
        this.parent = parent;
        this.deadline = deadline;
        this.externalSignal = externalSignal;
        this.cancellable = cancellable;
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a token that reports cancellation whenever the supplier returns {@code true}.
     */
    public static CancellationToken fromSupplier(Supplier<Boolean> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return new CancellationToken(null, null, () -> Boolean.TRUE.equals(supplier.get()), true);
    }

    /**
     * Creates a token that is cancelled once the future is cancelled.
     */
    public static CancellationToken fromCompletableFuture(CompletableFuture<?> future) {
        Objects.requireNonNull(future, "future");
        return new CancellationToken(null, null, future::isCancelled, true);
    }

    /**
     * Creates a token whose deadline is {@code timeout} from now.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(null, Instant.now().plus(timeout), () -> false, true);
    }

    /**
     * Derives a child token that is cancelled when this token is, and additionally
     * after {@code timeout} has elapsed.
     */
    public CancellationToken withTimeoutLinked(Duration timeout) {
        Instant childDeadline = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(childDeadline) ? deadline : childDeadline;
        return new CancellationToken(this, effective, () -> false, true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (isDeadlineExceeded()) {
            return true;
        }
        if (parent != null && parent.isCancelled()) {
            return true;
        }
        return externalSignal.get();
    }

    /**
     * @return {@code true} if this token (or one of its ancestors) ran past its deadline
     */
    public boolean isDeadlineExceeded() {
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return true;
        }
        return parent != null && parent.isDeadlineExceeded();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, or empty if this token has none.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return parent == null ? Optional.empty() : parent.remaining();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Requests cancellation. Has no effect on {@link #none()}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    /**
     * @throws CancellationException if this token is cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(isDeadlineExceeded()
                    ? "Operation deadline exceeded"
                    : "Operation was cancelled");
        }
    }
}
