package com.askus.backend.auth;

@FunctionalInterface
public interface TokenFetcher {

    /**
     * @throws com.askus.backend.util.ExternalCallException when the token endpoint fails
     */
    IssuedToken fetch();
}
