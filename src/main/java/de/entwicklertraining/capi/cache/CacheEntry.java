package de.entwicklertraining.capi.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cached payload with an absolute expiry and an optional ETag.
 *
 * @param data      the cached response body
 * @param expiresAt instant after which the entry must not be served
 * @param etag       validator returned by the server, or {@code null}
 * @param statusCode status of the cached response
 */
public record CacheEntry(byte[] data, Instant expiresAt, String etag, int statusCode) {

    public CacheEntry {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public CacheEntry(byte[] data, Instant expiresAt, String etag) {
        this(data, expiresAt, etag, 200);
    }

    public CacheEntry(byte[] data, Instant expiresAt) {
        this(data, expiresAt, null, 200);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Optional<String> getETag() {
        return Optional.ofNullable(etag).filter(s -> !s.isEmpty());
    }
}
