package de.entwicklertraining.capi.auth;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TokenTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void testFromResponse() {
        JSONObject json = new JSONObject()
                .put("access_token", "at")
                .put("refresh_token", "rt")
                .put("expires_in", 3600)
                .put("token_type", "bearer");

        Token token = Token.fromResponse(json, NOW);

        assertEquals("at", token.accessToken());
        assertEquals("rt", token.getRefreshToken().orElseThrow());
        assertEquals(NOW.plusSeconds(3600), token.getExpiresAt().orElseThrow());
    }

    @Test
    void testMissingExpiryNeverExpires() {
        Token token = Token.fromResponse(new JSONObject().put("access_token", "at"), NOW);

        assertTrue(token.getExpiresAt().isEmpty());
        assertTrue(token.isValid(NOW.plusSeconds(1_000_000)));
    }

    @Test
    void testInvalidWithinSkew() {
        Token token = new Token("at", null, NOW.plusSeconds(20), Token.TYPE_BEARER);

        assertFalse(token.isValid(NOW));
        assertTrue(token.isValid(NOW.minusSeconds(20)));
    }

    @Test
    void testEmptyTokenIsInvalid() {
        assertFalse(new Token("", null, null, Token.TYPE_BEARER).isValid(NOW));
    }
}
