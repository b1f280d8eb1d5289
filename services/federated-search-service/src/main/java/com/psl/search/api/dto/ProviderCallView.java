package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.psl.search.execution.FanOutResult;

public class ProviderCallView {
    private String query;
    private String provider;
    private String outcome;

    @JsonProperty("took_ms")
    private long tookMs;

    private boolean fallback;

    public static ProviderCallView from(FanOutResult.ProviderCall call) {
        ProviderCallView view = new ProviderCallView();
        view.query = call.getQuery();
        view.provider = call.getProvider();
        view.outcome = call.getOutcome();
        view.tookMs = call.getTookMs();
        view.fallback = call.isFallback();
        return view;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getOutcome() {
        return outcome;
    }

    public void setOutcome(String outcome) {
        this.outcome = outcome;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public boolean isFallback() {
        return fallback;
    }

    public void setFallback(boolean fallback) {
        this.fallback = fallback;
    }
}
