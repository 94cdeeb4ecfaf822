package de.entwicklertraining.capi.auth;

import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * An issued bearer token. Tokens are replaced wholesale, never modified.
 *
 * @param accessToken  the bearer value
 * @param refreshToken refresh token issued alongside, or {@code null}
 * @param expiresAt    expiry, or {@code null} if the issuer did not say
 * @param tokenType    token type, normally {@code bearer}
 */
public record Token(String accessToken, String refreshToken, Instant expiresAt, String tokenType) {

    /** Tokens this close to expiry are treated as expired. */
    public static final Duration EXPIRY_SKEW = Duration.ofSeconds(30);

    public static final String TYPE_BEARER = "bearer";

    /**
     * Parses a token endpoint response.
     *
     * @param json       the JSON body
     * @param receivedAt when the response arrived; {@code expires_in} counts from here
     */
    public static Token fromResponse(JSONObject json, Instant receivedAt) {
        long expiresIn = json.optLong("expires_in", 0);
        String refresh = json.optString("refresh_token", "");
        return new Token(
                json.getString("access_token"),
                refresh.isEmpty() ? null : refresh,
                expiresIn > 0 ? receivedAt.plusSeconds(expiresIn) : null,
                json.optString("token_type", TYPE_BEARER));
    }

    /**
     * A token is valid if it is non-empty and does not expire within {@link #EXPIRY_SKEW}.
     * A token without expiry never expires.
     */
    public boolean isValid(Instant now) {
        if (accessToken == null || accessToken.isEmpty()) {
            return false;
        }
        return expiresAt == null || now.plus(EXPIRY_SKEW).isBefore(expiresAt);
    }

    public Optional<String> getRefreshToken() {
        return Optional.ofNullable(refreshToken).filter(s -> !s.isEmpty());
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    @Override
    public String toString() {
        return "Token{type=" + tokenType + ", expiresAt=" + expiresAt + ", refreshable=" + getRefreshToken().isPresent() + "}";
    }
}
