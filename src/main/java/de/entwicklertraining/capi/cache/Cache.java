package de.entwicklertraining.capi.cache;

/**
 * Key/value store for response payloads.
 * <p>
 * Implementations must be safe for concurrent use.
 */
public interface Cache {

    /**
     * Returns the entry stored under {@code key}.
     *
     * @throws CacheException if the key is absent, expired or the backend is unavailable
     */
    CacheEntry get(String key);

    void set(String key, CacheEntry entry);

    void delete(String key);

    void clear();

    /**
     * @return {@code true} if a non-expired entry exists for {@code key}
     */
    boolean has(String key);
}
