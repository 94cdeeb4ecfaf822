package de.entwicklertraining.capi;

import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import de.entwicklertraining.capi.interceptor.InterceptorChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP transport of the request pipeline with interceptor support and an exponential backoff
 * retry loop.
 * <p>
 * One execution cycle runs the request interceptors, performs the HTTP call (unless an
 * interceptor supplied a short-circuit response, e.g. from the cache) and runs the response
 * interceptors. {@link #executeWithRetry} repeats the cycle while the response is flagged
 * retry-eligible or the call failed in transport. {@link #execute} additionally turns error
 * statuses into {@link ApiException}s.
 *
 * <p>Usually assembled through {@link ApiPipelineBuilder}.
 */
public class ApiClient {
    private static final Logger logger = LoggerFactory.getLogger(ApiClient.class.getName());

    // HttpClient callbacks run on a shared daemon pool
    private static final ExecutorService HTTP_CLIENT_EXECUTOR = Executors.newCachedThreadPool(daemonThreads("capi-http-"));

    // Cancel watchers get their own pool so a busy transport cannot starve them
    private static final ExecutorService CANCEL_WATCHER_EXECUTOR = Executors.newCachedThreadPool(daemonThreads("capi-cancel-watcher-"));

    private static final long CANCEL_POLL_INTERVAL_MS = 100;
    private static final long SLEEP_SLICE_MS = 50;

    /** The HTTP client used to execute requests */
    protected final HttpClient httpClient;

    /** The settings for this API client */
    protected final ApiClientSettings settings;

    /** The HTTP configuration for this API client */
    protected final ApiHttpConfiguration httpConfig;

    private final InterceptorChain interceptors;
    private final String baseUrl;

    /**
     * Creates a client with default settings and an empty interceptor chain.
     *
     * @param baseUrl The base URL (e.g., "https://api.example.com")
     */
    public ApiClient(String baseUrl) {
        this(baseUrl, ApiClientSettings.defaults(), new ApiHttpConfiguration(), new InterceptorChain());
    }

    /**
     * Creates a new ApiClient.
     *
     * @param baseUrl      The base URL for all requests; a trailing slash is removed
     * @param settings     retry and timeout settings
     * @param httpConfig   transport-level headers and request modifiers
     * @param interceptors the interceptor chain every cycle runs through
     * @throws IllegalArgumentException if the baseUrl is null or empty
     */
    public ApiClient(String baseUrl, ApiClientSettings settings, ApiHttpConfiguration httpConfig,
                     InterceptorChain interceptors) {
        this(baseUrl, settings, httpConfig, interceptors, HttpClient.newBuilder()
                .executor(HTTP_CLIENT_EXECUTOR)
                .connectTimeout(settings.getConnectTimeout())
                .build());
    }

    protected ApiClient(String baseUrl, ApiClientSettings settings, ApiHttpConfiguration httpConfig,
                        InterceptorChain interceptors, HttpClient httpClient) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be null or empty");
        }
        // Ensure the base URL doesn't end with a slash
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.settings = settings;
        this.httpConfig = httpConfig;
        this.interceptors = interceptors;
        this.httpClient = httpClient;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ApiClientSettings getSettings() {
        return settings;
    }

    public InterceptorChain getInterceptors() {
        return interceptors;
    }

    /**
     * Executes a request with retries and fails on error statuses.
     *
     * @return the successful (status below 400) response
     * @throws ApiException          if the final response has a status of 400 or above
     * @throws TransportException    if the call never produced a response
     * @throws ApiTimeoutException   if the call timed out
     * @throws CancellationException if the token was cancelled
     */
    public ApiResponse execute(ApiRequest request, CancellationToken cancellationToken) {
        ApiResponse response = executeWithRetry(request, cancellationToken);
        Optional<Throwable> error = response.getError();
        if (error.isPresent()) {
            Throwable t = error.get();
            if (t instanceof ApiClientException) {
                throw (ApiClientException) t;
            }
            throw new TransportException("Request failed: " + t.getMessage(), t);
        }
        if (response.getStatusCode() >= 400) {
            throw ApiException.parse(response.getStatusCode(), response.getBodyAsString());
        }
        return response;
    }

    /**
     * Runs execution cycles until the response is neither retry-eligible nor a transport failure,
     * or the retries configured in {@link RetryConfig} are used up. The last response is returned
     * as is, error statuses included.
     */
    public ApiResponse executeWithRetry(ApiRequest request, CancellationToken cancellationToken) {
        RetryConfig retry = settings.getRetryConfig();
        long delayMs = retry.getRetryDelay().toMillis();

        for (int attempt = 0; ; attempt++) {
            cancellationToken.throwIfCancelled();
            ApiResponse response = exchange(request, cancellationToken);

            boolean transportFailure = response.getError().isPresent();
            if (!response.isRetryEligible() && !transportFailure) {
                return response;
            }
            if (attempt >= retry.getMaxRetries()) {
                if (attempt > 0) {
                    logger.warn("Maximum retries of {} exhausted for {}", retry.getMaxRetries(), request);
                }
                return response;
            }

            long sleepMs = Math.min(retryAfterMs(response).orElse(delayMs), retry.getMaxDelay().toMillis());
            logger.warn("Retrying {} in {} ms (retry {}/{}): {}", request, sleepMs, attempt + 1, retry.getMaxRetries(),
                    transportFailure ? response.getError().get().getMessage() : "HTTP " + response.getStatusCode());
            applySleep(sleepMs, cancellationToken);
            delayMs = Math.min(calculateNextSleep(delayMs), retry.getMaxDelay().toMillis());
        }
    }

    /**
     * Runs one execution cycle: request interceptors, transport (unless short-circuited),
     * response interceptors. Transport failures come back as a response with an error.
     */
    public ApiResponse exchange(ApiRequest request, CancellationToken cancellationToken) {
        request.setShortCircuitResponse(null);
        interceptors.executeRequestInterceptors(request, cancellationToken);

        ApiResponse response = request.getShortCircuitResponse()
                .orElseGet(() -> runRequest(request, cancellationToken));

        interceptors.executeResponseInterceptors(request, response, cancellationToken);
        return response;
    }

    /**
     * Performs the HTTP call for a request using Java's HttpClient.
     * Handles cancellation and timeouts.
     *
     * @param request           the request, after the request interceptors ran
     * @param cancellationToken polled while the call is in flight
     * @return the response, or a failed response carrying a {@link TransportException} or {@link ApiTimeoutException}
     * @throws CancellationException if the token was cancelled during the call
     */
    protected ApiResponse runRequest(ApiRequest request, CancellationToken cancellationToken) {
        HttpRequest httpRequest = buildHttpRequest(request);

        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());

        // Polls every 100ms whether the token was cancelled
        CompletableFuture<Void> cancelWatcher = CompletableFuture.runAsync(() -> {
            try {
                while (!Thread.currentThread().isInterrupted() && !future.isDone()) {
                    if (cancellationToken.isCancelled()) {
                        future.cancel(true);
                        break;
                    }
                    Thread.sleep(CANCEL_POLL_INTERVAL_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, CANCEL_WATCHER_EXECUTOR);

        Duration timeout = effectiveTimeout(request);
        try {
            HttpResponse<byte[]> httpResponse = timeout.isZero()
                    ? future.get()
                    : future.get(timeout.toMillis() + CANCEL_POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            return new ApiResponse(request, httpResponse.statusCode(), firstValues(httpResponse), httpResponse.body());

        } catch (java.util.concurrent.CancellationException cex) {
            throw new CancellationException("Request was canceled: " + request, cex);

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Request interrupted: " + request, ie);

        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof HttpTimeoutException) {
                return ApiResponse.failed(request, new ApiTimeoutException(
                        "Request timed out after " + timeout.toMillis() + " ms", cause));
            }
            return ApiResponse.failed(request, new TransportException("Request failed: " + cause.getMessage(), cause));

        } catch (TimeoutException e) {
            future.cancel(true);
            return ApiResponse.failed(request, new ApiTimeoutException(
                    "Maximum execution time of " + timeout.toMillis() + " ms has been reached", e));

        } finally {
            cancelWatcher.cancel(true);
        }
    }

    private HttpRequest buildHttpRequest(ApiRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + request.getRelativeUrl()))
                .header("Accept", ApiHttpConfiguration.DEFAULT_ACCEPT);
        if (httpConfig.getUserAgent() != null) {
            builder.setHeader("User-Agent", httpConfig.getUserAgent());
        }
        Duration timeout = effectiveTimeout(request);
        if (!timeout.isZero()) {
            builder.timeout(timeout);
        }

        // Apply global headers from HTTP configuration
        httpConfig.getGlobalHeaders().forEach(builder::setHeader);

        // Apply request modifiers from HTTP configuration
        httpConfig.getRequestModifiers().forEach(modifier -> modifier.accept(builder));

        // Apply request-specific headers (these can override global headers)
        request.getHeaders().forEach(builder::setHeader);
        if (request.hasBody() && request.getHeader("Content-Type").isEmpty()) {
            builder.setHeader("Content-Type", "application/json");
        }

        HttpRequest.BodyPublisher body = request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.getBody())
                : HttpRequest.BodyPublishers.noBody();
        String method = request.getMethod();
        switch (method) {
            case "GET" -> builder.GET();
            case "DELETE" -> builder.method("DELETE", body);
            case "POST", "PUT", "PATCH" -> builder.method(method, body);
            default -> throw new ApiClientException(ErrorKind.TRANSPORT, "Unsupported HTTP method: " + method);
        }
        return builder.build();
    }

    private Duration effectiveTimeout(ApiRequest request) {
        Duration timeout = request.getTimeout().orElse(settings.getRequestTimeout());
        return timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
    }

    private static Map<String, String> firstValues(HttpResponse<?> response) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                headers.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return headers;
    }

    /**
     * Reads {@code Retry-After} (in seconds) from 429 and 503 responses.
     */
    private static Optional<Long> retryAfterMs(ApiResponse response) {
        int status = response.getStatusCode();
        if (status != 429 && status != 503) {
            return Optional.empty();
        }
        return response.getHeader("Retry-After").flatMap(value -> {
            try {
                return Optional.of(TimeUnit.SECONDS.toMillis(Long.parseLong(value.trim())));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After header '{}'", value);
                return Optional.empty();
            }
        });
    }

    /**
     * Calculates the next sleep duration using exponential backoff.
     *
     * @param currentDelay The current delay in milliseconds
     * @return The next delay in milliseconds
     */
    protected long calculateNextSleep(long currentDelay) {
        double factor = settings.getExponentialBase();
        if (settings.isUseJitter()) {
            factor *= (1.0 + Math.random());
        }
        return (long) (currentDelay * factor);
    }

    /**
     * Sleeps for {@code delayMs} unless the token is cancelled first or its deadline would pass
     * during the sleep.
     *
     * @param delayMs           The time to sleep, in milliseconds
     * @param cancellationToken checked in short slices while sleeping
     */
    protected void applySleep(long delayMs, CancellationToken cancellationToken) {
        Optional<Duration> remaining = cancellationToken.remaining();
        if (remaining.isPresent() && delayMs > remaining.get().toMillis()) {
            throw new ApiTimeoutException(
                    "Skipping sleep to prevent timeout (remaining: " + remaining.get().toMillis() + " ms)");
        }

        long deadline = System.currentTimeMillis() + delayMs;
        try {
            long left;
            while ((left = deadline - System.currentTimeMillis()) > 0) {
                cancellationToken.throwIfCancelled();
                Thread.sleep(Math.min(left, SLEEP_SLICE_MS));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during backoff", e);
        }
        cancellationToken.throwIfCancelled();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------
    // Transport exceptions
    // ---------------------------------------

    /**
     * Exception thrown when a call did not produce an HTTP response.
     * <p>
     * Common cases include:
     * <ul>
     *   <li>Network connectivity issues</li>
     *   <li>Connection refused or reset</li>
     *   <li>Unsupported request methods</li>
     * </ul>
     *
     * <p>This is different from {@link ApiException}, which represents an error response
     * the server did send.
     */
    public static class TransportException extends ApiClientException {
        /**
         * Creates a new TransportException with the specified detail message and cause.
         *
         * @param message the detail message
         * @param cause   the underlying I/O failure
         */
        public TransportException(String message, Throwable cause) {
            super(ErrorKind.TRANSPORT, message, cause);
        }
    }

    /**
     * Exception indicating that a call could not complete within the allowed time.
     * <p>
     * This exception is thrown when:
     * <ul>
     *   <li>The request timeout is exceeded</li>
     *   <li>A retry backoff would run past the caller's deadline</li>
     * </ul>
     *
     * <p>This is different from an HTTP 504 response, which arrives as an {@link ApiException}.
     */
    public static class ApiTimeoutException extends ApiClientException {
        public ApiTimeoutException(String message) {
            super(ErrorKind.TIMEOUT, message);
        }

        public ApiTimeoutException(String message, Throwable cause) {
            super(ErrorKind.TIMEOUT, message, cause);
        }
    }
}
