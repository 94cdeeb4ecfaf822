package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Creates cache backends from a {@link CacheConfig}.
 */
public final class CacheFactory {
    private static final Logger logger = LoggerFactory.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
    }

    /**
     * @param config the configuration, or {@code null} for {@link CacheConfig#defaults()}
     * @throws CacheException with {@link ErrorKind#UNSUPPORTED_CACHE_TYPE} for backends that cannot be built
     */
    public static Cache create(CacheConfig config) {
        CacheConfig effective = config == null ? CacheConfig.defaults() : config;
        switch (effective.getType()) {
            case MEMORY: {
                MemoryCache cache = new MemoryCache(effective.getMaxSize());
                Duration interval = effective.getCleanupInterval();
                if (interval != null && !interval.isZero() && !interval.isNegative()) {
                    cache.startCleanup(interval);
                }
                logger.debug("Created memory cache (maxSize={}, cleanup={})", effective.getMaxSize(), interval);
                return cache;
            }
            case NONE:
                return new NoOpCache();
            default:
                throw new CacheException(ErrorKind.UNSUPPORTED_CACHE_TYPE, effective.getType().getValue());
        }
    }

    /**
     * Creates a backend from a configuration value such as {@code "memory"} or {@code "none"}.
     */
    public static Cache create(String type) {
        return create(CacheConfig.builder().type(CacheType.fromValue(type)).build());
    }
}
