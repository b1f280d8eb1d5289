package com.psl.search.provider;

import java.util.List;

/**
 * Result of one provider call: either candidates (possibly empty) or a failure reason. Never both.
 */
public final class ProviderOutcome {
    private final String provider;
    private final List<RawCandidate> candidates;
    private final String errorReason;
    private final long tookMs;

    private ProviderOutcome(String provider, List<RawCandidate> candidates, String errorReason, long tookMs) {
        this.provider = provider;
        this.candidates = candidates;
        this.errorReason = errorReason;
        this.tookMs = tookMs;
    }

    public static ProviderOutcome ok(String provider, List<RawCandidate> candidates, long tookMs) {
        return new ProviderOutcome(provider, candidates == null ? List.of() : List.copyOf(candidates), null, tookMs);
    }

    public static ProviderOutcome err(String provider, String reason, long tookMs) {
        return new ProviderOutcome(provider, List.of(), reason == null ? "unknown" : reason, tookMs);
    }

    public boolean isOk() {
        return errorReason == null;
    }

    public boolean hasCandidates() {
        return isOk() && !candidates.isEmpty();
    }

    public String getProvider() {
        return provider;
    }

    public List<RawCandidate> getCandidates() {
        return candidates;
    }

    public String getErrorReason() {
        return errorReason;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String summary() {
        if (!isOk()) {
            return "err:" + errorReason;
        }
        return candidates.isEmpty() ? "empty" : "ok:" + candidates.size();
    }
}
