package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ErrorKind;

/**
 * Cache backend that stores nothing. Used when caching is switched off.
 */
public final class NoOpCache implements Cache {

    @Override
    public CacheEntry get(String key) {
        throw new CacheException(ErrorKind.CACHE_DISABLED, key);
    }

    @Override
    public void set(String key, CacheEntry entry) {
        // nothing to store
    }

    @Override
    public void delete(String key) {
        // nothing to delete
    }

    @Override
    public void clear() {
        // nothing to clear
    }

    @Override
    public boolean has(String key) {
        return false;
    }
}
