package de.entwicklertraining.capi.interceptor;

import de.entwicklertraining.capi.ApiRequest;
import de.entwicklertraining.capi.ApiResponse;
import de.entwicklertraining.capi.auth.AuthenticationException;
import de.entwicklertraining.capi.auth.TokenManager;
import de.entwicklertraining.capi.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches {@code Authorization: Bearer <token>} to every request.
 * <p>
 * On a 401 response the stored token is dropped and the response is marked retry-eligible,
 * once per request, so the retry loop can try again with a fresh token.
 */
public class AuthenticationInterceptor implements RequestInterceptor, ResponseInterceptor {
    private static final Logger logger = LoggerFactory.getLogger(AuthenticationInterceptor.class.getName());

    static final String METADATA_AUTH_RETRIED = "auth_retried";

    private final TokenManager tokenManager;

    public AuthenticationInterceptor(TokenManager tokenManager) {
        this.tokenManager = tokenManager;
    }

    @Override
    public void onRequest(ApiRequest request, CancellationToken cancellationToken) {
        String token;
        try {
            token = tokenManager.getToken(cancellationToken);
        } catch (AuthenticationException e) {
            throw new AuthenticationException("failed to get authentication token: " + e.getMessage(),
                    e.getStatusCode(), e.getError().orElse(null), e.getErrorDescription().orElse(null), e);
        }
        request.setHeader("Authorization", "Bearer " + token);
    }

    @Override
    public void onResponse(ApiRequest request, ApiResponse response, CancellationToken cancellationToken) {
        if (response.getStatusCode() != 401 || response.isFromCache()) {
            return;
        }
        if (request.getMetadata(METADATA_AUTH_RETRIED).isPresent()) {
            return;
        }
        logger.debug("Received 401 for {}, invalidating token", request);
        tokenManager.invalidate();
        request.putMetadata(METADATA_AUTH_RETRIED, Boolean.TRUE);
        response.markRetryEligible();
    }
}
