package com.psl.search.provider;

public interface ProviderAdapter {
    String id();

    String displayName();

    boolean isEnabled();

    /**
     * Searches the provider. An empty candidate list is a successful outcome; failures are returned, not thrown.
     */
    ProviderOutcome search(String query, int limit);

    String circuitState();
}
