package de.entwicklertraining.capi.auth;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Credential material for a {@link TokenManager}. Exactly one {@link GrantType} is derived from it.
 * <p>
 * Example usage:
 * <pre>
 * Credentials credentials = Credentials.builder()
 *     .tokenUrl("https://uaa.example.com/oauth/token")
 *     .clientCredentials("my-client", "my-secret")
 *     .build();
 * </pre>
 */
public final class Credentials {

    /** Client id the cf CLI registers with UAA; used when a password grant has no client configured. */
    public static final String DEFAULT_PASSWORD_CLIENT_ID = "cf";

    private final String endpoint;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String username;
    private final String password;
    private final String passwordClientId;
    private final String passwordClientSecret;
    private final String refreshToken;
    private final String accessToken;
    private final Instant accessTokenExpiry;
    private final List<String> scopes;

    private Credentials(Builder builder) {
        this.endpoint = builder.endpoint;
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.username = builder.username;
        this.password = builder.password;
        this.passwordClientId = builder.passwordClientId;
        this.passwordClientSecret = builder.passwordClientSecret;
        this.refreshToken = builder.refreshToken;
        this.accessToken = builder.accessToken;
        this.accessTokenExpiry = builder.accessTokenExpiry;
        this.scopes = List.copyOf(builder.scopes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .endpoint(endpoint)
                .tokenUrl(tokenUrl)
                .refreshToken(refreshToken)
                .accessToken(accessToken, accessTokenExpiry)
                .scopes(scopes);
        b.clientId = clientId;
        b.clientSecret = clientSecret;
        b.username = username;
        b.password = password;
        b.passwordClientId = passwordClientId;
        b.passwordClientSecret = passwordClientSecret;
        return b;
    }

    /**
     * Selects the grant strategy. Precedence: static token, static token with password fallback,
     * client credentials, password, refresh token, none.
     */
    public GrantType grantType() {
        boolean hasPassword = isSet(username) && isSet(password);
        if (isSet(accessToken)) {
            return hasPassword ? GrantType.STATIC_WITH_PASSWORD_FALLBACK : GrantType.STATIC;
        }
        if (isSet(clientId) && isSet(clientSecret)) {
            return GrantType.CLIENT_CREDENTIALS;
        }
        if (hasPassword) {
            return GrantType.PASSWORD;
        }
        if (isSet(refreshToken)) {
            return GrantType.REFRESH_TOKEN;
        }
        return GrantType.NONE;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    public Optional<String> getEndpoint() {
        return Optional.ofNullable(endpoint);
    }

    public Optional<String> getTokenUrl() {
        return Optional.ofNullable(tokenUrl);
    }

    public Optional<String> getClientId() {
        return Optional.ofNullable(clientId).filter(Credentials::isSet);
    }

    public Optional<String> getClientSecret() {
        return Optional.ofNullable(clientSecret);
    }

    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public Optional<String> getPassword() {
        return Optional.ofNullable(password);
    }

    /**
     * Client that authenticates the password grant; {@value #DEFAULT_PASSWORD_CLIENT_ID} if none was given.
     */
    public String getPasswordClientId() {
        return isSet(passwordClientId) ? passwordClientId : DEFAULT_PASSWORD_CLIENT_ID;
    }

    public String getPasswordClientSecret() {
        return passwordClientSecret == null ? "" : passwordClientSecret;
    }

    public Optional<String> getRefreshToken() {
        return Optional.ofNullable(refreshToken).filter(Credentials::isSet);
    }

    public Optional<String> getAccessToken() {
        return Optional.ofNullable(accessToken).filter(Credentials::isSet);
    }

    public Optional<Instant> getAccessTokenExpiry() {
        return Optional.ofNullable(accessTokenExpiry);
    }

    public List<String> getScopes() {
        return scopes;
    }

    @Override
    public String toString() {
        // secrets stay out of logs
        return "Credentials{grantType=" + grantType() + ", tokenUrl=" + tokenUrl
                + ", clientId=" + clientId + ", username=" + username + "}";
    }

    public static final class Builder {
        private String endpoint;
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String username;
        private String password;
        private String passwordClientId;
        private String passwordClientSecret;
        private String refreshToken;
        private String accessToken;
        private Instant accessTokenExpiry;
        private List<String> scopes = List.of();

        private Builder() {
        }

        /**
         * The Cloud Controller API endpoint these credentials belong to.
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientCredentials(String clientId, String clientSecret) {
            this.clientId = clientId;
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder password(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * Client used for HTTP Basic auth of the password grant. Unlike
         * {@link #clientCredentials(String, String)} this does not select the client-credentials grant.
         */
        public Builder passwordClient(String clientId, String clientSecret) {
            this.passwordClientId = clientId;
            this.passwordClientSecret = clientSecret;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder accessToken(String accessToken) {
            return accessToken(accessToken, null);
        }

        /**
         * @param expiry expiry of the token, or {@code null} if unknown
         */
        public Builder accessToken(String accessToken, Instant expiry) {
            this.accessToken = accessToken;
            this.accessTokenExpiry = expiry;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes == null ? List.of() : scopes;
            return this;
        }

        public Credentials build() {
            return new Credentials(this);
        }
    }
}
