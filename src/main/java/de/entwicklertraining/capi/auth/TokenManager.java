package de.entwicklertraining.capi.auth;

import de.entwicklertraining.capi.cancellation.CancellationToken;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Supplies bearer tokens to the request pipeline.
 */
public interface TokenManager {

    /**
     * Returns a valid access token, obtaining a new one if the current one is missing or expired.
     *
     * @throws AuthenticationException if no token can be obtained
     * @throws de.entwicklertraining.capi.cancellation.CancellationException if cancelled while waiting
     */
    String getToken(CancellationToken cancellationToken);

    /**
     * Obtains a new token even if the current one is still valid.
     */
    void refreshToken(CancellationToken cancellationToken);

    /**
     * Replaces the current token.
     *
     * @param expiresAt expiry, or {@code null} for a token without expiry
     */
    void setToken(String accessToken, Instant expiresAt);

    /**
     * Drops the current token so the next {@link #getToken} obtains a fresh one.
     */
    void invalidate();

    boolean isTokenExpiringSoon(Duration within);

    Optional<Instant> getTokenExpiry();
}
