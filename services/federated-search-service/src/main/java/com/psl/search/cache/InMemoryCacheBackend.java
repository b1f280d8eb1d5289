package com.psl.search.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

public class InMemoryCacheBackend implements CacheBackend {
    private final TtlCache<String> values;
    private final TtlCache<Long> counters;

    public InMemoryCacheBackend(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public InMemoryCacheBackend(int maxEntries, LongSupplier clock) {
        this.values = new TtlCache<>(maxEntries, clock);
        this.counters = new TtlCache<>(maxEntries, clock);
    }

    @Override
    public Optional<String> get(String key) {
        return values.get(key).map(CacheEntry::getValue);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, value, ttl.toMillis());
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        return values.removeByPrefix(prefix);
    }

    @Override
    public long increment(String key, Duration ttl) {
        return counters.compute(key, current -> current == null ? 1L : current + 1L, ttl.toMillis());
    }

    @Override
    public String name() {
        return "memory";
    }
}
