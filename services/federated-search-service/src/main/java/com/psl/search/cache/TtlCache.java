package com.psl.search.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.UnaryOperator;

/**
 * Bounded in-process map with per-entry expiry. When full, the oldest insertion is evicted first.
 * Iteration order of {@code entries} is insertion order; a put always moves the key to the newest end.
 */
public class TtlCache<V> {
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final int maxEntries;
    private final LongSupplier clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public TtlCache(int maxEntries, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public synchronized Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.getAsLong())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public synchronized void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.getAsLong();
        entries.remove(key);
        entries.put(key, new CacheEntry<>(value, now, now + ttlMs));
        evictIfNeeded(now);
    }

    public synchronized V compute(String key, UnaryOperator<V> updater, long ttlMs) {
        long now = clock.getAsLong();
        CacheEntry<V> existing = entries.get(key);
        if (existing != null && !existing.isExpiredAt(now)) {
            CacheEntry<V> updated =
                new CacheEntry<>(updater.apply(existing.getValue()), existing.getCreatedAt(), existing.getExpiresAt());
            entries.put(key, updated);
            return updated.getValue();
        }
        entries.remove(key);
        CacheEntry<V> created = new CacheEntry<>(updater.apply(null), now, now + ttlMs);
        entries.put(key, created);
        evictIfNeeded(now);
        return created.getValue();
    }

    public synchronized boolean remove(String key) {
        return key != null && entries.remove(key) != null;
    }

    public synchronized int removeByPrefix(String prefix) {
        int removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evictIfNeeded(long now) {
        if (entries.size() <= maxEntries) {
            return;
        }
        entries.values().removeIf(entry -> entry.isExpiredAt(now));
        Iterator<Map.Entry<String, CacheEntry<V>>> oldest = entries.entrySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
