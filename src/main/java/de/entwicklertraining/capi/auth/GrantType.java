package de.entwicklertraining.capi.auth;

/**
 * How a {@link TokenManager} obtains its bearer token, in order of precedence.
 */
public enum GrantType {
    /** A pre-issued access token is used as is. */
    STATIC,
    /** A pre-issued access token, replaced through the password grant once it stops working. */
    STATIC_WITH_PASSWORD_FALLBACK,
    CLIENT_CREDENTIALS,
    PASSWORD,
    REFRESH_TOKEN,
    /** No credential material; requests are sent unauthenticated. */
    NONE
}
