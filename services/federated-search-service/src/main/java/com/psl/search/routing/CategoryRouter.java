package com.psl.search.routing;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps a free-text query to a category, its provider hierarchy and a search mode. No side effects.
 */
@Component
public class CategoryRouter {
    private static final Set<String> LEAD_WORDS = Set.of(
        "how", "what", "why", "when", "where", "who", "which",
        "explain", "describe", "understand", "work", "function"
    );
    private static final List<String> COMPLEX_TERMS = List.of(
        "algorithm", "methodology", "framework", "paradigm", "theory",
        "model", "approach", "technique", "mechanism"
    );

    private final CategoryCatalog catalog;
    private final RoutingProperties properties;

    public CategoryRouter(CategoryCatalog catalog, RoutingProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    public RoutePlan route(String query, String explicitCategory, SearchMode explicitMode) {
        boolean categoryInferred = explicitCategory == null || explicitCategory.isBlank();
        SearchCategory category = categoryInferred
            ? catalog.require(inferCategory(query))
            : catalog.require(explicitCategory.trim());
        boolean modeInferred = explicitMode == null;
        SearchMode mode = modeInferred ? inferMode(query) : explicitMode;
        return new RoutePlan(category, mode, categoryInferred, modeInferred);
    }

    public String inferCategory(String query) {
        String lower = lower(query);
        String best = null;
        int bestScore = 0;
        for (SearchCategory category : catalog.all()) {
            int score = category.keywordScore(lower);
            if (score > bestScore) {
                best = category.getId();
                bestScore = score;
            }
        }
        if (best == null) {
            return catalog.find(properties.getDefaultCategory()).map(SearchCategory::getId).orElse(CategoryCatalog.GENERAL);
        }
        return best;
    }

    public SearchMode inferMode(String query) {
        String lower = lower(query);
        if (lower.isEmpty()) {
            return SearchMode.FAST;
        }
        if (isQuestion(lower) || isLong(lower) || hasComplexTerm(lower)) {
            return SearchMode.EXPAND;
        }
        return SearchMode.FAST;
    }

    public RouteSuggestion suggest(String query) {
        SearchMode mode = inferMode(query);
        SearchCategory category = catalog.require(inferCategory(query));
        String reason = mode == SearchMode.EXPAND
            ? "Detected as question or complex academic query"
            : "Detected as simple keyword search";
        return new RouteSuggestion(query, mode, category, reason);
    }

    private boolean isQuestion(String lower) {
        if (lower.contains("?")) {
            return true;
        }
        String first = lower.split("\\s+", 2)[0].replaceAll("[^a-z]", "");
        return LEAD_WORDS.contains(first);
    }

    private boolean isLong(String lower) {
        return lower.split("\\s+").length > properties.getExpandTokenThreshold();
    }

    private boolean hasComplexTerm(String lower) {
        for (String term : COMPLEX_TERMS) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}
