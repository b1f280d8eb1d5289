package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.psl.search.provider.ProviderAdapter;

public class ProviderView {
    private String id;
    private String name;
    private boolean enabled;

    @JsonProperty("circuit_state")
    private String circuitState;

    public static ProviderView from(ProviderAdapter adapter) {
        ProviderView view = new ProviderView();
        view.id = adapter.id();
        view.name = adapter.displayName();
        view.enabled = adapter.isEnabled();
        view.circuitState = adapter.circuitState();
        return view;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getCircuitState() {
        return circuitState;
    }
}
