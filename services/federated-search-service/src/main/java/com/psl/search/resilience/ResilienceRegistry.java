package com.psl.search.resilience;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class ResilienceRegistry {
    private final ResilienceProperties properties;
    private final CircuitBreaker embedBreaker;
    private final Map<String, CircuitBreaker> providerBreakers = new ConcurrentHashMap<>();

    public ResilienceRegistry(ResilienceProperties properties) {
        this.properties = properties;
        this.embedBreaker = new CircuitBreaker(properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs());
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker providerBreaker(String providerId) {
        return providerBreakers.computeIfAbsent(
            providerId,
            id -> new CircuitBreaker(properties.getProviderFailureThreshold(), properties.getProviderOpenMs())
        );
    }
}
