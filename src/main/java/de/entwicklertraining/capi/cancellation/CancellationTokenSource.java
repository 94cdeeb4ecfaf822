package de.entwicklertraining.capi.cancellation;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Owner side of a {@link CancellationToken}. Hand the token to callees, keep the source to cancel.
 */
public final class CancellationTokenSource {

    private final CancellationToken token;

    private CancellationTokenSource(CancellationToken token) {
        this.token = token;
    }

    public static CancellationTokenSource create() {
        return new CancellationTokenSource(new CancellationToken(null, null, () -> false, true));
    }

    /**
     * Creates a source whose token cancels itself after the given timeout.
     */
    public static CancellationTokenSource create(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new CancellationTokenSource(new CancellationToken(null, Instant.now().plus(timeout), () -> false, true));
    }

    /**
     * Creates a source whose token also observes {@code parent}.
     */
    public static CancellationTokenSource linkedTo(CancellationToken parent) {
        Objects.requireNonNull(parent, "parent");
        return new CancellationTokenSource(new CancellationToken(parent, null, () -> false, true));
    }

    public CancellationToken getToken() {
        return token;
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancelled();
    }
}
