package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ApiClientException;
import de.entwicklertraining.capi.ErrorKind;

/**
 * Raised by {@link Cache} backends. The {@link #getKind() kind} tells a plain miss
 * ({@link ErrorKind#CACHE_MISS}, {@link ErrorKind#CACHE_EXPIRED}, {@link ErrorKind#CACHE_NOT_FOUND_IN_ANY},
 * {@link ErrorKind#CACHE_DISABLED}) from a real backend failure.
 */
public class CacheException extends ApiClientException {

    private final String key;

    public CacheException(ErrorKind kind, String key) {
        super(kind, key == null ? kind.getDefaultMessage() : kind.getDefaultMessage() + ": " + key);
        this.key = key;
    }

    public CacheException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.key = null;
    }

    /**
     * @return the key that was looked up, or {@code null} if not applicable
     */
    public String getKey() {
        return key;
    }

    public boolean isMiss() {
        return switch (getKind()) {
            case CACHE_MISS, CACHE_EXPIRED, CACHE_NOT_FOUND_IN_ANY, CACHE_DISABLED -> true;
            default -> false;
        };
    }
}
