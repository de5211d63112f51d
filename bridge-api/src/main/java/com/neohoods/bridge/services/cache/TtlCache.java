package com.neohoods.bridge.services.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Thread-safe key/value cache whose entries expire a fixed time after they were written.
 * <p>
 * Expired entries are dropped lazily: a read past the deadline misses and removes the entry.
 * A non-positive TTL disables caching, every read misses and nothing is stored.
 * An optional copier is applied on both write and read so callers never share a mutable value with the cache.
 */
public class TtlCache<K, V> {

    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final Clock clock;
    private final UnaryOperator<V> copier;

    public TtlCache(Duration ttl, Clock clock) {
        this(ttl, clock, UnaryOperator.identity());
    }

    public TtlCache(Duration ttl, Clock clock, UnaryOperator<V> copier) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
        this.copier = copier;
    }

    public boolean isEnabled() {
        return !ttl.isZero() && !ttl.isNegative();
    }

    public Optional<V> get(K key) {
        if (!isEnabled() || key == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.isExpired(now)) {
                return Optional.ofNullable(copier.apply(entry.value));
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // another writer may have refreshed the entry in between
            Entry<V> entry = entries.get(key);
            if (entry != null) {
                if (!entry.isExpired(now)) {
                    return Optional.ofNullable(copier.apply(entry.value));
                }
                entries.remove(key);
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void put(K key, V value) {
        if (!isEnabled() || key == null || value == null) {
            return;
        }
        Entry<V> entry = new Entry<>(copier.apply(value), clock.instant().plus(ttl));
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate(K key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
