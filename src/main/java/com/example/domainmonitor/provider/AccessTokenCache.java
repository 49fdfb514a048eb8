package com.example.domainmonitor.provider;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Lazily refreshed OAuth access token.
 *
 * States: EXPIRED → REFRESHING → VALID (→ EXPIRED once the expiry passes). Exactly one
 * caller performs a refresh; callers arriving meanwhile wait for its outcome instead of
 * starting their own. The refresh call itself runs outside the lock.
 */
@Slf4j
public class AccessTokenCache {

    public enum State {
        EXPIRED, REFRESHING, VALID
    }

    public record TokenInfo(String accessToken, Instant expiresAt) {
    }

    private final String provider;
    private final Supplier<TokenInfo> refresher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition refreshFinished = lock.newCondition();
    private State state = State.EXPIRED;
    private TokenInfo current;

    public AccessTokenCache(String provider, Supplier<TokenInfo> refresher, Clock clock) {
        this.provider = provider;
        this.refresher = refresher;
        this.clock = clock;
    }

    /**
     * Returns a token that has not expired, refreshing it first when needed.
     *
     * @throws ProviderException if the refresh fails or the caller is interrupted while waiting
     */
    public String getToken() {
        lock.lock();
        try {
            while (true) {
                if (state == State.VALID && clock.instant().isBefore(current.expiresAt())) {
                    return current.accessToken();
                }
                if (state != State.REFRESHING) {
                    state = State.REFRESHING;
                    break;
                }
                try {
                    refreshFinished.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException(provider, "token", "Interrupted while waiting for token refresh", e);
                }
            }
        } finally {
            lock.unlock();
        }

        TokenInfo fresh = null;
        try {
            fresh = refresher.get();
            log.info("[{}] Access token refreshed, expires at {}", provider, fresh.expiresAt());
            return fresh.accessToken();
        } finally {
            lock.lock();
            try {
                current = fresh;
                state = fresh != null ? State.VALID : State.EXPIRED;
                refreshFinished.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    public State getState() {
        lock.lock();
        try {
            if (state == State.VALID && !clock.instant().isBefore(current.expiresAt())) {
                return State.EXPIRED;
            }
            return state;
        } finally {
            lock.unlock();
        }
    }
}
