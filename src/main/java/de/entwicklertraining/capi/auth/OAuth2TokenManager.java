package de.entwicklertraining.capi.auth;

import de.entwicklertraining.capi.cancellation.CancellationException;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * {@link TokenManager} that talks OAuth2 to a UAA-style token endpoint.
 * <p>
 * The grant is chosen from the {@link Credentials} (see {@link Credentials#grantType()}).
 * Refreshes are single-flight: callers arriving while a refresh is running wait for it and
 * reuse its result instead of starting their own exchange.
 */
public class OAuth2TokenManager implements TokenManager {
    private static final Logger logger = LoggerFactory.getLogger(OAuth2TokenManager.class.getName());

    public static final List<String> UAA_SCOPES = List.of("cloud_controller.read", "cloud_controller.write");

    private static final Duration EXCHANGE_TIMEOUT = Duration.ofSeconds(30);
    private static final long POLL_INTERVAL_MS = 100;

    private final Credentials credentials;
    private final HttpClient httpClient;
    private final Clock clock;
    private final TokenStore store = new TokenStore();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final List<TokenRefreshListener> listeners = new CopyOnWriteArrayList<>();

    public OAuth2TokenManager(Credentials credentials) {
        this(credentials, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Clock.systemUTC());
    }

    public OAuth2TokenManager(Credentials credentials, HttpClient httpClient, Clock clock) {
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.clock = clock;
        credentials.getAccessToken().ifPresent(token -> store.set(
                new Token(token, credentials.getRefreshToken().orElse(null),
                        credentials.getAccessTokenExpiry().orElse(null), Token.TYPE_BEARER)));
    }

    /**
     * Manager for a UAA server using the client-credentials grant.
     *
     * @param uaaUrl base URL of the UAA, with or without trailing slash
     */
    public static OAuth2TokenManager forUaa(String uaaUrl, String clientId, String clientSecret) {
        return new OAuth2TokenManager(Credentials.builder()
                .tokenUrl(uaaTokenUrl(uaaUrl))
                .clientCredentials(clientId, clientSecret)
                .scopes(UAA_SCOPES)
                .build());
    }

    /**
     * Manager for a UAA server using the password grant, authenticated as the given client.
     */
    public static OAuth2TokenManager forUaaWithPassword(String uaaUrl, String clientId, String clientSecret,
                                                        String username, String password) {
        return new OAuth2TokenManager(Credentials.builder()
                .tokenUrl(uaaTokenUrl(uaaUrl))
                .passwordClient(clientId, clientSecret)
                .password(username, password)
                .scopes(UAA_SCOPES)
                .build());
    }

    static String uaaTokenUrl(String uaaUrl) {
        String base = uaaUrl.endsWith("/") ? uaaUrl.substring(0, uaaUrl.length() - 1) : uaaUrl;
        return base + "/oauth/token";
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void addRefreshListener(TokenRefreshListener listener) {
        listeners.add(listener);
    }

    /**
     * @return the stored token, if any
     */
    public Optional<Token> currentToken() {
        return Optional.ofNullable(store.get());
    }

    @Override
    public String getToken(CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        Token current = store.get();
        if (current != null && current.isValid(clock.instant())) {
            return current.accessToken();
        }
        lockForRefresh(cancellationToken);
        try {
            // another caller may have refreshed while we waited
            current = store.get();
            if (current != null && current.isValid(clock.instant())) {
                return current.accessToken();
            }
            return obtainAndStore(current, cancellationToken).accessToken();
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void refreshToken(CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        lockForRefresh(cancellationToken);
        try {
            obtainAndStore(store.get(), cancellationToken);
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void setToken(String accessToken, Instant expiresAt) {
        Token previous = store.get();
        String refresh = previous == null ? null : previous.refreshToken();
        store.set(new Token(accessToken, refresh, expiresAt, Token.TYPE_BEARER));
    }

    @Override
    public void invalidate() {
        logger.debug("Invalidating stored token");
        store.clear();
    }

    @Override
    public boolean isTokenExpiringSoon(Duration within) {
        Token token = store.get();
        if (token == null) {
            return true;
        }
        return token.getExpiresAt()
                .map(expiry -> clock.instant().plus(within).isAfter(expiry))
                .orElse(false);
    }

    @Override
    public Optional<Instant> getTokenExpiry() {
        return Optional.ofNullable(store.get()).flatMap(Token::getExpiresAt);
    }

    private void lockForRefresh(CancellationToken cancellationToken) {
        try {
            while (!refreshLock.tryLock(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                cancellationToken.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for token refresh", e);
        }
    }

    private Token obtainAndStore(Token current, CancellationToken cancellationToken) {
        Token fresh = obtain(current, cancellationToken);
        store.set(fresh);
        logger.debug("Obtained new token ({})", fresh);
        for (TokenRefreshListener listener : listeners) {
            try {
                listener.onTokenRefreshed(fresh);
            } catch (RuntimeException e) {
                logger.warn("Token refresh listener failed: {}", e.getMessage(), e);
            }
        }
        return fresh;
    }

    private Token obtain(Token current, CancellationToken cancellationToken) {
        GrantType grantType = credentials.grantType();
        Optional<String> refreshToken = Optional.ofNullable(current)
                .flatMap(Token::getRefreshToken)
                .or(credentials::getRefreshToken);

        switch (grantType) {
            case STATIC:
                if (refreshToken.isPresent()) {
                    return refreshGrant(refreshToken.get(), cancellationToken);
                }
                throw new AuthenticationException("static token cannot be refreshed");
            case STATIC_WITH_PASSWORD_FALLBACK:
                logger.info("Static token no longer usable, falling back to password grant");
                return passwordGrant(cancellationToken);
            case CLIENT_CREDENTIALS:
                return clientCredentialsGrant(cancellationToken);
            case PASSWORD:
                if (refreshToken.isPresent()) {
                    try {
                        return refreshGrant(refreshToken.get(), cancellationToken);
                    } catch (AuthenticationException e) {
                        logger.debug("Refresh token rejected ({}), using password grant", e.getMessage());
                    }
                }
                return passwordGrant(cancellationToken);
            case REFRESH_TOKEN:
                return refreshGrant(refreshToken.orElseThrow(
                        () -> new AuthenticationException("no valid credentials available")), cancellationToken);
            case NONE:
            default:
                throw new AuthenticationException("no valid credentials available");
        }
    }

    private Token clientCredentialsGrant(CancellationToken cancellationToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        addScope(form);
        return exchange(form, credentials.getClientId().orElseThrow(), credentials.getClientSecret().orElse(""),
                cancellationToken);
    }

    private Token passwordGrant(CancellationToken cancellationToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "password");
        form.put("username", credentials.getUsername().orElse(""));
        form.put("password", credentials.getPassword().orElse(""));
        addScope(form);
        return exchange(form, credentials.getPasswordClientId(), credentials.getPasswordClientSecret(),
                cancellationToken);
    }

    private Token refreshGrant(String refreshToken, CancellationToken cancellationToken) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        String clientId = credentials.getClientId().orElse(credentials.getPasswordClientId());
        String secret = credentials.getClientId().isPresent()
                ? credentials.getClientSecret().orElse("")
                : credentials.getPasswordClientSecret();
        return exchange(form, clientId, secret, cancellationToken);
    }

    private void addScope(Map<String, String> form) {
        if (!credentials.getScopes().isEmpty()) {
            form.put("scope", String.join(" ", credentials.getScopes()));
        }
    }

    private Token exchange(Map<String, String> form, String clientId, String clientSecret,
                           CancellationToken cancellationToken) {
        String tokenUrl = credentials.getTokenUrl()
                .orElseThrow(() -> new AuthenticationException("no token URL configured"));
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        String basic = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(EXCHANGE_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("Authorization", "Basic " + basic)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        logger.debug("Requesting token via {} grant from {}", form.get("grant_type"), tokenUrl);
        HttpResponse<String> response = await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()),
                cancellationToken);
        Instant receivedAt = clock.instant();

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw failure(response);
        }
        try {
            return Token.fromResponse(new JSONObject(response.body()), receivedAt);
        } catch (JSONException e) {
            throw new AuthenticationException("invalid token response: " + e.getMessage(), e);
        }
    }

    private <T> T await(CompletableFuture<T> future, CancellationToken cancellationToken) {
        try {
            while (true) {
                try {
                    return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (cancellationToken.isCancelled()) {
                        future.cancel(true);
                        throw new CancellationException("Token request was cancelled");
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted during token request", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AuthenticationException("token request failed: " + cause.getMessage(), cause);
        }
    }

    private static AuthenticationException failure(HttpResponse<String> response) {
        String error = null;
        String description = null;
        try {
            JSONObject json = new JSONObject(response.body());
            error = json.optString("error", null);
            description = json.optString("error_description", null);
        } catch (JSONException e) {
            description = response.body();
        }
        StringBuilder message = new StringBuilder("token request failed (HTTP ")
                .append(response.statusCode()).append(")");
        if (error != null) {
            message.append(": ").append(error);
        }
        if (description != null && !description.isBlank()) {
            message.append(" - ").append(description);
        }
        return new AuthenticationException(message.toString(), response.statusCode(), error, description, null);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
