package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process cache with least-recently-used eviction.
 * <p>
 * Expired entries are purged lazily on {@link #get(String)} and in bulk by {@link #cleanup()},
 * which can also be scheduled with {@link #startCleanup(Duration)}.
 */
public class MemoryCache implements Cache, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MemoryCache.class.getName());

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry> entries;
    private ScheduledExecutorService cleanupExecutor;

    public MemoryCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public MemoryCache(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    public MemoryCache(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.clock = clock;
        // access order gives LRU iteration order
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                boolean evict = size() > MemoryCache.this.maxSize;
                if (evict) {
                    logger.debug("Evicting least recently used cache entry {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized CacheEntry get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            throw new CacheException(ErrorKind.CACHE_MISS, key);
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            throw new CacheException(ErrorKind.CACHE_EXPIRED, key);
        }
        return entry;
    }

    @Override
    public synchronized void set(String key, CacheEntry entry) {
        entries.put(key, entry);
    }

    @Override
    public synchronized void delete(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public synchronized boolean has(String key) {
        CacheEntry entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Removes all expired entries.
     *
     * @return the number of entries removed
     */
    public synchronized int cleanup() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * Runs {@link #cleanup()} periodically on a daemon thread until {@link #close()} is called.
     */
    public synchronized void startCleanup(Duration interval) {
        if (cleanupExecutor != null) {
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, interval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(this::cleanup, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            cleanupExecutor = null;
        }
    }
}
