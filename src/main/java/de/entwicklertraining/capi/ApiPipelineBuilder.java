package de.entwicklertraining.capi;

import de.entwicklertraining.capi.auth.TokenManager;
import de.entwicklertraining.capi.cache.CacheManager;
import de.entwicklertraining.capi.cache.SmartCache;
import de.entwicklertraining.capi.cache.SmartCacheConfig;
import de.entwicklertraining.capi.circuit.CircuitBreaker;
import de.entwicklertraining.capi.interceptor.AuthenticationInterceptor;
import de.entwicklertraining.capi.interceptor.CircuitBreakerInterceptor;
import de.entwicklertraining.capi.interceptor.HeaderInterceptor;
import de.entwicklertraining.capi.interceptor.InterceptorChain;
import de.entwicklertraining.capi.interceptor.LoggingInterceptor;
import de.entwicklertraining.capi.interceptor.MetricsCollector;
import de.entwicklertraining.capi.interceptor.MetricsInterceptor;
import de.entwicklertraining.capi.interceptor.RateLimitInterceptor;
import de.entwicklertraining.capi.interceptor.RetryInterceptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles an {@link ApiClient} with the stock interceptors in a fixed order.
 * <p>
 * Request phase: logging, headers, rate limit, circuit breaker, auth, metrics, cache.<br>
 * Response phase: metrics, circuit breaker, auth, retry, cache, logging.
 * <p>
 * Every stage is optional. Leaving out the token manager means requests are sent without
 * an {@code Authorization} header.
 *
 * <pre>
 * ApiClient client = ApiPipelineBuilder.forEndpoint("https://api.example.com")
 *     .tokenManager(new OAuth2TokenManager(credentials))
 *     .rateLimit(rateLimiter)
 *     .circuitBreaker(new CircuitBreaker())
 *     .smartCache(new CacheManager(new MemoryCache()), SmartCacheConfig.defaults())
 *     .build();
 * </pre>
 */
public final class ApiPipelineBuilder {

    private final String baseUrl;
    private ApiClientSettings settings = ApiClientSettings.defaults();
    private ApiHttpConfiguration httpConfig = new ApiHttpConfiguration();
    private boolean logging = true;
    private LoggingInterceptor loggingInterceptor;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private RateLimitInterceptor rateLimiter;
    private CircuitBreaker circuitBreaker;
    private TokenManager tokenManager;
    private MetricsCollector metricsCollector;
    private CacheManager cacheManager;
    private SmartCacheConfig smartCacheConfig;

    private ApiPipelineBuilder(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    public static ApiPipelineBuilder forEndpoint(String baseUrl) {
        return new ApiPipelineBuilder(baseUrl);
    }

    public ApiPipelineBuilder settings(ApiClientSettings settings) {
        this.settings = settings;
        return this;
    }

    public ApiPipelineBuilder httpConfiguration(ApiHttpConfiguration httpConfig) {
        this.httpConfig = httpConfig;
        return this;
    }

    public ApiPipelineBuilder logging(boolean enabled) {
        this.logging = enabled;
        return this;
    }

    public ApiPipelineBuilder logging(LoggingInterceptor interceptor) {
        this.logging = true;
        this.loggingInterceptor = interceptor;
        return this;
    }

    public ApiPipelineBuilder header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Uses the given limiter. The caller owns it and closes it when done.
     */
    public ApiPipelineBuilder rateLimit(RateLimitInterceptor rateLimiter) {
        this.rateLimiter = rateLimiter;
        return this;
    }

    public ApiPipelineBuilder circuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
        return this;
    }

    public ApiPipelineBuilder tokenManager(TokenManager tokenManager) {
        this.tokenManager = tokenManager;
        return this;
    }

    public ApiPipelineBuilder metrics(MetricsCollector collector) {
        this.metricsCollector = collector;
        return this;
    }

    public ApiPipelineBuilder smartCache(CacheManager manager, SmartCacheConfig config) {
        this.cacheManager = manager;
        this.smartCacheConfig = config;
        return this;
    }

    public ApiClient build() {
        InterceptorChain chain = new InterceptorChain();
        LoggingInterceptor loggingStage = logging
                ? (loggingInterceptor != null ? loggingInterceptor : new LoggingInterceptor())
                : null;
        AuthenticationInterceptor auth = tokenManager == null ? null : new AuthenticationInterceptor(tokenManager);
        CircuitBreakerInterceptor breaker = circuitBreaker == null ? null : new CircuitBreakerInterceptor(circuitBreaker);
        MetricsInterceptor metrics = metricsCollector == null ? null : new MetricsInterceptor(metricsCollector);

        // request phase
        if (loggingStage != null) {
            chain.addRequestInterceptor(loggingStage);
        }
        if (!headers.isEmpty()) {
            chain.addRequestInterceptor(new HeaderInterceptor(headers));
        }
        if (rateLimiter != null) {
            chain.addRequestInterceptor(rateLimiter);
        }
        if (breaker != null) {
            chain.addRequestInterceptor(breaker);
        }
        if (auth != null) {
            chain.addRequestInterceptor(auth);
        }
        if (metrics != null) {
            chain.addRequestInterceptor(metrics);
        }

        // response phase
        if (metrics != null) {
            chain.addResponseInterceptor(metrics);
        }
        if (breaker != null) {
            chain.addResponseInterceptor(breaker);
        }
        if (auth != null) {
            chain.addResponseInterceptor(auth);
        }
        chain.addResponseInterceptor(new RetryInterceptor(settings.getRetryConfig()));

        // adds the cache stage at the end of both phases
        if (cacheManager != null) {
            SmartCache.configure(chain, cacheManager, smartCacheConfig);
        }
        if (loggingStage != null) {
            chain.addResponseInterceptor(loggingStage);
        }
        return new ApiClient(baseUrl, settings, httpConfig, chain);
    }
}
