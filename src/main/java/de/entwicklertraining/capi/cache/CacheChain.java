package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Multi-tier cache: tier 0 is probed first. A hit in a lower tier is copied into
 * every tier above it before it is returned.
 * <p>
 * Writes go to all tiers. Every tier is attempted even if one fails; the last failure is rethrown.
 */
public class CacheChain implements Cache {
    private static final Logger logger = LoggerFactory.getLogger(CacheChain.class.getName());

    private final List<Cache> tiers;

    public CacheChain(Cache... tiers) {
        this(List.of(tiers));
    }

    public CacheChain(List<Cache> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public List<Cache> getTiers() {
        return tiers;
    }

    @Override
    public CacheEntry get(String key) {
        for (int i = 0; i < tiers.size(); i++) {
            CacheEntry entry;
            try {
                entry = tiers.get(i).get(key);
            } catch (CacheException e) {
                continue;
            }
            for (int j = 0; j < i; j++) {
                try {
                    tiers.get(j).set(key, entry);
                } catch (RuntimeException e) {
                    logger.warn("Could not repopulate cache tier {} for key {}: {}", j, key, e.getMessage());
                }
            }
            return entry;
        }
        throw new CacheException(ErrorKind.CACHE_NOT_FOUND_IN_ANY, key);
    }

    @Override
    public void set(String key, CacheEntry entry) {
        forEachTier(tier -> tier.set(key, entry));
    }

    @Override
    public void delete(String key) {
        forEachTier(tier -> tier.delete(key));
    }

    @Override
    public void clear() {
        forEachTier(Cache::clear);
    }

    @Override
    public boolean has(String key) {
        return tiers.stream().anyMatch(tier -> tier.has(key));
    }

    private void forEachTier(Consumer<Cache> action) {
        RuntimeException lastError = null;
        for (Cache tier : tiers) {
            try {
                action.accept(tier);
            } catch (RuntimeException e) {
                lastError = e;
            }
        }
        if (lastError != null) {
            throw lastError;
        }
    }
}
