package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Front end to a {@link Cache} backend used by the cache interceptors.
 * <p>
 * Builds request keys, applies the default TTL, counts hits, misses and sets, and remembers
 * which keys it wrote so that a mutation can invalidate every key that belongs to a path.
 * <p>
 * The backend may drop entries on its own (eviction, expiry cleanup). Once the key index holds
 * twice the backend capacity, keys the backend no longer has are pruned.
 * <p>
 * Entries stored with an ETag are also kept as validators, bounded by the backend capacity, so
 * that a GET for an expired entry can still be sent as a conditional request and a
 * {@code 304 Not Modified} can be answered with the old payload.
 */
public class CacheManager {
    private static final Logger logger = LoggerFactory.getLogger(CacheManager.class.getName());

    private final Cache cache;
    private final CacheOptions options;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    private final Set<String> keyIndex = new HashSet<>();
    private final int pruneThreshold;
    // guarded by keyIndex
    private final LinkedHashMap<String, CacheEntry> validators;
    private final boolean keepValidators;

    public CacheManager(Cache cache) {
        this(cache, null);
    }

    /**
     * @param cache   backend, or {@code null} for a {@link MemoryCache} sized by the options
     * @param options options, or {@code null} for {@link CacheOptions#defaults()}
     */
    public CacheManager(Cache cache, CacheOptions options) {
        this(cache, options, Clock.systemUTC());
    }

    public CacheManager(Cache cache, CacheOptions options, Clock clock) {
        this.options = options == null ? CacheOptions.defaults() : options;
        this.cache = cache == null ? new MemoryCache(this.options.maxSize(), clock) : cache;
        this.clock = clock;
        int capacity = this.cache instanceof MemoryCache
                ? ((MemoryCache) this.cache).getMaxSize()
                : this.options.maxSize();
        this.pruneThreshold = 2 * Math.max(1, capacity);
        this.keepValidators = !(this.cache instanceof NoOpCache);
        int validatorLimit = Math.max(1, capacity);
        this.validators = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > validatorLimit;
            }
        };
    }

    /**
     * Builds the cache key {@code METHOD:PATH} or {@code METHOD:PATH:k1=v1&k2=v2}
     * with parameters sorted by name.
     */
    public static String cacheKey(String method, String path, Map<String, String> params) {
        String base = method.toUpperCase(Locale.ROOT) + ":" + path;
        if (params == null || params.isEmpty()) {
            return base;
        }
        String query = new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return base + ":" + query;
    }

    public static String cacheKey(ApiRequest request) {
        return cacheKey(request.getMethod(), request.getPath(), request.getQueryParams());
    }

    public void set(String key, byte[] data, Duration ttl) {
        setWithETag(key, data, null, ttl);
    }

    /**
     * Stores {@code data} under {@code key}. A {@code null} or non-positive TTL means the default TTL.
     */
    public void setWithETag(String key, byte[] data, String etag, Duration ttl) {
        setResponse(key, data, etag, 200, ttl);
    }

    /**
     * Stores a response payload together with its status code.
     */
    public void setResponse(String key, byte[] data, String etag, int statusCode, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? options.defaultTtl() : ttl;
        String storedETag = options.enableETags() ? etag : null;
        CacheEntry entry = new CacheEntry(data, clock.instant().plus(effectiveTtl), storedETag, statusCode);
        cache.set(key, entry);
        synchronized (keyIndex) {
            keyIndex.add(key);
            if (storedETag != null && keepValidators) {
                validators.put(key, entry);
            } else {
                validators.remove(key);
            }
            if (keyIndex.size() > pruneThreshold) {
                pruneIndex();
            }
        }
        sets.incrementAndGet();
    }

    // caller holds the keyIndex monitor
    private void pruneIndex() {
        int before = keyIndex.size();
        keyIndex.removeIf(key -> !cache.has(key));
        logger.debug("Pruned {} cache keys no longer held by the backend", before - keyIndex.size());
    }

    /**
     * Looks up the payload stored under {@code key} and counts a hit or a miss.
     */
    public Optional<byte[]> get(String key) {
        return getEntry(key).map(CacheEntry::data);
    }

    /**
     * Like {@link #get(String)} but returns the whole entry.
     */
    public Optional<CacheEntry> getEntry(String key) {
        Optional<CacheEntry> entry = lookup(key);
        if (entry.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return entry;
    }

    /**
     * Returns the ETag stored for {@code key} without touching the statistics. Expired entries
     * keep their ETag until they are replaced, deleted or invalidated.
     */
    public Optional<String> getETag(String key) {
        Optional<String> live = lookup(key).flatMap(CacheEntry::getETag);
        if (live.isPresent()) {
            return live;
        }
        return validator(key).flatMap(CacheEntry::getETag);
    }

    /**
     * Returns the entry a {@code 304 Not Modified} for {@code key} refers to: the live entry, or
     * the expired one kept as a validator. Counts a hit or a miss.
     */
    public Optional<CacheEntry> getForRevalidation(String key) {
        Optional<CacheEntry> entry = lookup(key).or(() -> validator(key));
        if (entry.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return entry;
    }

    private Optional<CacheEntry> validator(String key) {
        synchronized (keyIndex) {
            return Optional.ofNullable(validators.get(key));
        }
    }

    /**
     * Extends the lifetime of an existing entry, e.g. after a {@code 304 Not Modified}.
     *
     * @return the refreshed entry, empty if there was nothing to refresh
     */
    public Optional<CacheEntry> refresh(String key, Duration ttl) {
        Optional<CacheEntry> current = lookup(key);
        current.ifPresent(entry -> setResponse(key, entry.data(), entry.etag(), entry.statusCode(), ttl));
        return current;
    }

    private Optional<CacheEntry> lookup(String key) {
        try {
            return Optional.of(cache.get(key));
        } catch (CacheException e) {
            if (!e.isMiss()) {
                throw e;
            }
            if (e.getKind() != ErrorKind.CACHE_DISABLED) {
                synchronized (keyIndex) {
                    keyIndex.remove(key);
                }
            }
            return Optional.empty();
        }
    }

    public void delete(String key) {
        synchronized (keyIndex) {
            keyIndex.remove(key);
            validators.remove(key);
        }
        cache.delete(key);
    }

    public void clear() {
        synchronized (keyIndex) {
            keyIndex.clear();
            validators.clear();
        }
        cache.clear();
    }

    /**
     * Removes every cached GET response that a successful mutation of {@code path} makes stale:
     * the path itself, everything below it and its parent collection, with or without query parameters.
     *
     * @return the number of keys removed
     */
    public int invalidateRelated(String path) {
        String target = stripTrailingSlash(path);
        int lastSlash = target.lastIndexOf('/');
        String parent = lastSlash > 0 ? target.substring(0, lastSlash) : null;

        List<String> stale = new ArrayList<>();
        synchronized (keyIndex) {
            Set<String> known = new HashSet<>(keyIndex);
            known.addAll(validators.keySet());
            for (String key : known) {
                String keyPath = pathOf(key);
                if (keyPath == null) {
                    continue;
                }
                if (keyPath.equals(target) || keyPath.startsWith(target + "/") || keyPath.equals(parent)) {
                    stale.add(key);
                }
            }
            stale.forEach(key -> {
                keyIndex.remove(key);
                validators.remove(key);
            });
        }
        for (String key : stale) {
            try {
                cache.delete(key);
            } catch (RuntimeException e) {
                logger.warn("Failed to invalidate cache key {}: {}", key, e.getMessage());
            }
        }
        if (!stale.isEmpty()) {
            logger.debug("Invalidated {} cache entries for {}", stale.size(), path);
        }
        return stale.size();
    }

    private static String pathOf(String key) {
        if (!key.startsWith("GET:")) {
            return null;
        }
        String rest = key.substring(4);
        int sep = rest.indexOf(':');
        return stripTrailingSlash(sep < 0 ? rest : rest.substring(0, sep));
    }

    private static String stripTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    /**
     * Keys written through this manager that have not been deleted or found missing since.
     */
    public Set<String> trackedKeys() {
        synchronized (keyIndex) {
            return Set.copyOf(keyIndex);
        }
    }

    public CacheStats getStats() {
        return new CacheStats(hits.get(), misses.get(), sets.get());
    }

    public Cache getCache() {
        return cache;
    }

    public CacheOptions getOptions() {
        return options;
    }
}
