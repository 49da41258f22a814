package com.outcast.rivalry.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expiring key/value store where freshness is decided by the reader.
 *
 * <p>{@link #set} stamps the entry with the current time; {@link #get} takes the TTL the caller
 * needs and treats an entry at least that old as absent, evicting it. Concurrent writers to the
 * same key resolve as last write wins. There is no size bound: keys are limited to the leagues,
 * weeks and accounts of the runs in flight.
 */
public class TtlCache<K, V> {

    private record Entry<V>(V value, Instant createdAt) {}

    private final String name;
    private final Clock clock;
    private final ConcurrentHashMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    public Optional<V> get(K key, Duration ttl) {
        Entry<V> entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (isExpired(entry, ttl, clock.instant())) {
            // only drop the entry we judged; a fresher concurrent set survives
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry<>(value, clock.instant()));
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    /** Drops every entry at least {@code maxAge} old and returns how many went. */
    public int purgeOlderThan(Duration maxAge) {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> isExpired(e, maxAge, now));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public String getName() {
        return name;
    }

    private static boolean isExpired(Entry<?> entry, Duration ttl, Instant now) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return true;
        return Duration.between(entry.createdAt(), now).compareTo(ttl) >= 0;
    }
}
