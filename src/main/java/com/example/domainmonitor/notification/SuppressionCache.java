package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.NotificationType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Last successful send per (domain, notification type), across all channel configs of
 * one dispatcher. Entries expire after the retention period, which must exceed the
 * longest suppression window.
 */
public class SuppressionCache {

    private final Cache<String, Instant> lastSent;

    public SuppressionCache(Clock clock, Duration retention) {
        this.lastSent = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Optional<Instant> lastSent(String domainId, NotificationType type) {
        return Optional.ofNullable(lastSent.getIfPresent(key(domainId, type)));
    }

    public void recordSent(String domainId, NotificationType type, Instant sentAt) {
        lastSent.put(key(domainId, type), sentAt);
    }

    /** Drops expired entries. */
    public void evictExpired() {
        lastSent.cleanUp();
    }

    public long size() {
        return lastSent.estimatedSize();
    }

    static String key(String domainId, NotificationType type) {
        return domainId + ":" + type.code();
    }
}
