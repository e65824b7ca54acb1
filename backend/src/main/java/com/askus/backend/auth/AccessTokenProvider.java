package com.askus.backend.auth;

import java.util.Optional;

/**
 * Supplies the bearer credential for an outbound client, if any.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    Optional<String> bearerToken();

    /** Called when the server rejected the current credential. */
    default void invalidate() {
    }

    static AccessTokenProvider none() {
        return Optional::empty;
    }

    static AccessTokenProvider fixed(String token) {
        Optional<String> value = (token == null || token.isBlank()) ? Optional.empty() : Optional.of(token.trim());
        return () -> value;
    }
}
