package de.entwicklertraining.capi.auth;

/**
 * Notified each time a {@link TokenManager} obtains a new token, e.g. to persist it.
 */
@FunctionalInterface
public interface TokenRefreshListener {

    void onTokenRefreshed(Token token);
}
