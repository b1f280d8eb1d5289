package com.psl.search.service;

import java.util.Locale;
import java.util.Optional;

public enum RankBy {
    RELEVANCE,
    CITATIONS;

    public static Optional<RankBy> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(RELEVANCE);
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "relevance":
            case "hybrid":
                return Optional.of(RELEVANCE);
            case "citations":
                return Optional.of(CITATIONS);
            default:
                return Optional.empty();
        }
    }
}
