package com.psl.search.cache;

import java.time.Duration;
import java.util.Optional;

public class DisabledCacheBackend implements CacheBackend {

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public long deleteByPrefix(String prefix) {
        return 0L;
    }

    @Override
    public long increment(String key, Duration ttl) {
        return 0L;
    }

    @Override
    public String name() {
        return "none";
    }
}
