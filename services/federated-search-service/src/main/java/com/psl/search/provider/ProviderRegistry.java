package com.psl.search.provider;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Long-lived provider handles, built once at start-up. Each adapter owns its HTTP client, token bucket and breaker.
 */
@Component
public class ProviderRegistry {
    private final Map<String, ProviderAdapter> adapters;

    public ProviderRegistry(List<ProviderAdapter> adapters) {
        Map<String, ProviderAdapter> byId = new LinkedHashMap<>();
        for (ProviderAdapter adapter : adapters) {
            byId.put(adapter.id(), adapter);
        }
        this.adapters = Collections.unmodifiableMap(byId);
    }

    public Optional<ProviderAdapter> find(String id) {
        return Optional.ofNullable(adapters.get(id));
    }

    public boolean contains(String id) {
        return adapters.containsKey(id);
    }

    public Collection<ProviderAdapter> all() {
        return adapters.values();
    }
}
