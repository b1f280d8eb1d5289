package com.psl.search.routing;

import java.util.Locale;
import java.util.Optional;

public enum SearchMode {
    FAST("fast"),
    EXPAND("expand");

    private final String value;

    SearchMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Accepts the canonical names plus the "quick" / "ai" aliases used by older clients.
     */
    public static Optional<SearchMode> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "fast":
            case "quick":
                return Optional.of(FAST);
            case "expand":
            case "ai":
                return Optional.of(EXPAND);
            default:
                return Optional.empty();
        }
    }
}
