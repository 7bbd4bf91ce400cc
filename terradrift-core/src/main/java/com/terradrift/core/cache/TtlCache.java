package com.terradrift.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe key/value cache with a fixed time-to-live per entry.
 *
 * <p>Expired entries are evicted lazily when read, or in bulk by {@link #cleanup()}. Several
 * workers may read and write overlapping keys concurrently; a reader never observes a value
 * older than the TTL.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TtlCache<K, V> {

    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public TtlCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Stores a value, replacing any previous entry for the key.
     *
     * @param key cache key
     * @param value value to store
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    /**
     * Looks up a live entry.
     *
     * @param key cache key
     * @return the value, or empty if absent or expired
     */
    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // Only remove the entry we saw; a concurrent put may have replaced it
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void delete(K key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return Math.max(0, before - entries.size());
    }

    /**
     * Number of stored entries, including expired ones not yet evicted.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
