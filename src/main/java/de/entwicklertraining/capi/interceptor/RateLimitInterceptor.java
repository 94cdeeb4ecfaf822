package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket limiting requests to N per second.
 * <p>
 * The bucket starts full with N permits and gets one permit back every {@code 1s / N}
 * while it is not full. A request waits for a permit or until its cancellation token fires.
 * Close the interceptor to stop the refill thread.
 */
public class RateLimitInterceptor implements RequestInterceptor, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class.getName());

    private static final long WAIT_SLICE_MS = 50;

    private final int requestsPerSecond;
    private final Semaphore permits;
    private final ScheduledExecutorService refiller;

    public RateLimitInterceptor(int requestsPerSecond) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0");
        }
        this.requestsPerSecond = requestsPerSecond;
        this.permits = new Semaphore(requestsPerSecond);
        this.refiller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "rate-limit-refill");
            t.setDaemon(true);
            return t;
        });
        long periodMicros = Math.max(1, TimeUnit.SECONDS.toMicros(1) / requestsPerSecond);
        refiller.scheduleAtFixedRate(this::refill, periodMicros, periodMicros, TimeUnit.MICROSECONDS);
    }

    private void refill() {
        // only the refill thread releases, so the bucket never exceeds its capacity
        if (permits.availablePermits() < requestsPerSecond) {
            permits.release();
        }
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        try {
            while (!permits.tryAcquire(WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (cancellationToken.isCancelled()) {
                    throw new CancellationException("Cancelled while waiting for rate limit permit");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for rate limit permit", e);
        }
        logger.trace("Rate limit permit acquired for {}", request);
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    @Override
    public void close() {
        refiller.shutdownNow();
    }
}
