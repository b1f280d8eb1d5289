package com.psl.search.execution;

import com.psl.search.provider.ProviderOutcome;
import com.psl.search.provider.RawCandidate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Candidates from one executor run, concatenated in assignment order, plus a record of every provider call.
 */
public class FanOutResult {
    private final List<RawCandidate> candidates = new ArrayList<>();
    private final Set<String> sourcesUsed = new LinkedHashSet<>();
    private final List<ProviderCall> calls = new ArrayList<>();
    private int fallbacksActivated;

    void record(String query, ProviderOutcome outcome, boolean fallback) {
        calls.add(new ProviderCall(query, outcome.getProvider(), outcome.summary(), outcome.getTookMs(), fallback));
        if (outcome.hasCandidates()) {
            candidates.addAll(outcome.getCandidates());
            sourcesUsed.add(outcome.getProvider());
        }
    }

    void markFallback() {
        fallbacksActivated++;
    }

    public static FanOutResult empty() {
        return new FanOutResult();
    }

    public List<RawCandidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public List<String> getSourcesUsed() {
        return List.copyOf(sourcesUsed);
    }

    public List<ProviderCall> getCalls() {
        return Collections.unmodifiableList(calls);
    }

    public int getApiCalls() {
        return calls.size();
    }

    public int getFallbacksActivated() {
        return fallbacksActivated;
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public static class ProviderCall {
        private final String query;
        private final String provider;
        private final String outcome;
        private final long tookMs;
        private final boolean fallback;

        public ProviderCall(String query, String provider, String outcome, long tookMs, boolean fallback) {
            this.query = query;
            this.provider = provider;
            this.outcome = outcome;
            this.tookMs = tookMs;
            this.fallback = fallback;
        }

        public String getQuery() {
            return query;
        }

        public String getProvider() {
            return provider;
        }

        public String getOutcome() {
            return outcome;
        }

        public long getTookMs() {
            return tookMs;
        }

        public boolean isFallback() {
            return fallback;
        }
    }
}
