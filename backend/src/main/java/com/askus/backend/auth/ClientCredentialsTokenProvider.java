package com.askus.backend.auth;

import com.askus.backend.util.ExternalCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * OAuth2 client-credentials token cache. A token is reused until {@code skew}
 * before it expires, then fetched again. The skew never exceeds half the
 * token's lifetime, so short-lived tokens are still reused. At most one
 * refresh runs at a time; callers waiting for it can be interrupted.
 */
public class ClientCredentialsTokenProvider implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final TokenFetcher fetcher;
    private final Duration skew;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String token;
    private volatile Instant refreshAt = Instant.EPOCH;

    public ClientCredentialsTokenProvider(TokenFetcher fetcher, Duration skew, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.skew = (skew == null || skew.isNegative()) ? Duration.ZERO : skew;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<String> bearerToken() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException("oauth", "interrupted while waiting for token refresh", e);
        }
        try {
            if (isValid()) return Optional.of(token);

            IssuedToken issued = fetcher.fetch();
            if (issued == null || issued.accessToken() == null || issued.accessToken().isBlank()) {
                throw new ExternalCallException("oauth", "token endpoint returned no access_token");
            }

            long ttl = issued.expiresInSeconds() > 0 ? issued.expiresInSeconds() : DEFAULT_EXPIRES_IN;
            Duration lifetime = Duration.ofSeconds(ttl);
            Duration effectiveSkew = skew.compareTo(lifetime.dividedBy(2)) > 0 ? lifetime.dividedBy(2) : skew;

            token = issued.accessToken();
            refreshAt = clock.instant().plus(lifetime).minus(effectiveSkew);
            log.debug("refreshed access token, next refresh at {}", refreshAt);
            return Optional.of(token);
        } finally {
            lock.unlock();
        }
    }

    /** Drops the cached token, e.g. after the server rejected it. */
    @Override
    public void invalidate() {
        lock.lock();
        try {
            token = null;
            refreshAt = Instant.EPOCH;
        } finally {
            lock.unlock();
        }
    }

    private boolean isValid() {
        return token != null && clock.instant().isBefore(refreshAt);
    }
}
