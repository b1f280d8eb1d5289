package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class SearchMetadata {
    @JsonProperty("took_ms")
    private long tookMs;

    @JsonProperty("api_calls")
    private int apiCalls;

    @JsonProperty("fallbacks_activated")
    private int fallbacksActivated;

    @JsonProperty("expanded_queries")
    private List<String> expandedQueries;

    @JsonProperty("expansion_method")
    private String expansionMethod;

    @JsonProperty("local_hits")
    private int localHits;

    @JsonProperty("category_inferred")
    private boolean categoryInferred;

    @JsonProperty("mode_inferred")
    private boolean modeInferred;

    @JsonProperty("ranking")
    private String ranking;

    @JsonProperty("result_limit")
    private Integer resultLimit;

    @JsonProperty("cache_ttl_seconds")
    private Long cacheTtlSeconds;

    @JsonProperty("provider_outcomes")
    private List<ProviderCallView> providerOutcomes;

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public int getApiCalls() {
        return apiCalls;
    }

    public void setApiCalls(int apiCalls) {
        this.apiCalls = apiCalls;
    }

    public int getFallbacksActivated() {
        return fallbacksActivated;
    }

    public void setFallbacksActivated(int fallbacksActivated) {
        this.fallbacksActivated = fallbacksActivated;
    }

    public List<String> getExpandedQueries() {
        return expandedQueries;
    }

    public void setExpandedQueries(List<String> expandedQueries) {
        this.expandedQueries = expandedQueries;
    }

    public String getExpansionMethod() {
        return expansionMethod;
    }

    public void setExpansionMethod(String expansionMethod) {
        this.expansionMethod = expansionMethod;
    }

    public int getLocalHits() {
        return localHits;
    }

    public void setLocalHits(int localHits) {
        this.localHits = localHits;
    }

    public boolean isCategoryInferred() {
        return categoryInferred;
    }

    public void setCategoryInferred(boolean categoryInferred) {
        this.categoryInferred = categoryInferred;
    }

    public boolean isModeInferred() {
        return modeInferred;
    }

    public void setModeInferred(boolean modeInferred) {
        this.modeInferred = modeInferred;
    }

    public String getRanking() {
        return ranking;
    }

    public void setRanking(String ranking) {
        this.ranking = ranking;
    }

    public Integer getResultLimit() {
        return resultLimit;
    }

    public void setResultLimit(Integer resultLimit) {
        this.resultLimit = resultLimit;
    }

    public Long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(Long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public List<ProviderCallView> getProviderOutcomes() {
        return providerOutcomes;
    }

    public void setProviderOutcomes(List<ProviderCallView> providerOutcomes) {
        this.providerOutcomes = providerOutcomes;
    }
}
