package de.entwicklertraining.capi.auth;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe holder of the current token.
 */
public class TokenStore {

    private final AtomicReference<Token> current = new AtomicReference<>();

    /**
     * @return the current token, or {@code null}
     */
    public Token get() {
        return current.get();
    }

    public void set(Token token) {
        current.set(token);
    }

    public void clear() {
        current.set(null);
    }
}
