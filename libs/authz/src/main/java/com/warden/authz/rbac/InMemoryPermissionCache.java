package com.warden.authz.rbac;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link PermissionCache}. Expiry is checked on read; expired entries are removed
 * lazily. Concurrent writers for the same key are last-writer-wins.
 */
public class InMemoryPermissionCache implements PermissionCache {

    private record Entry(ResolvedPermissions value, Instant expiresAt) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPermissionCache() {
        this(Clock.systemUTC());
    }

    public InMemoryPermissionCache(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<ResolvedPermissions> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, ResolvedPermissions value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    /** Number of entries held, expired ones not yet evicted included. */
    public int size() {
        return entries.size();
    }
}
