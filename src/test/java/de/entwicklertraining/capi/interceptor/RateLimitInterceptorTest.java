package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitInterceptorTest {

    @Test
    void testRejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitInterceptor(0));
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testBurstThenThrottle() {
        try (RateLimitInterceptor limiter = new RateLimitInterceptor(5)) {
            long start = System.nanoTime();
            for (int i = 0; i < 5; i++) {
                limiter.onRequest(ApiRequest.get("/v3/apps"), CancellationToken.none());
            }
            long burstMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(burstMs < 150, "burst took " + burstMs + " ms");

            // the sixth request has to wait for a refill (one every 200 ms)
            limiter.onRequest(ApiRequest.get("/v3/apps"), CancellationToken.none());
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(totalMs >= 100, "sixth request came after " + totalMs + " ms");
        }
    }

    @Test
    void testRefillNeverExceedsCapacity() throws InterruptedException {
        try (RateLimitInterceptor limiter = new RateLimitInterceptor(3)) {
            Thread.sleep(500);

            assertEquals(3, limiter.availablePermits());
        }
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void testCancelledWhileWaiting() {
        try (RateLimitInterceptor limiter = new RateLimitInterceptor(1)) {
            limiter.onRequest(ApiRequest.get("/a"), CancellationToken.none());
            // drain the refill as well so the next caller must wait
            while (limiter.availablePermits() > 0) {
                limiter.onRequest(ApiRequest.get("/a"), CancellationToken.none());
            }

            assertThrows(CancellationException.class,
                    () -> limiter.onRequest(ApiRequest.get("/a"), CancellationToken.withTimeout(Duration.ofMillis(100))));
        }
    }
}
