package com.psl.search.routing;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class SearchCategory {
    private final String id;
    private final String displayName;
    private final String description;
    private final List<String> providers;
    private final List<String> keywords;
    private final int maxResults;

    public SearchCategory(
        String id,
        String displayName,
        String description,
        List<String> providers,
        List<String> keywords,
        int maxResults
    ) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.providers = List.copyOf(providers);
        this.keywords = keywords.stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
        this.maxResults = maxResults;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Provider ids in fallback order: primary, backup-1, backup-2.
     */
    public List<String> getProviders() {
        return providers;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public int keywordScore(String lowerCaseQuery) {
        int score = 0;
        for (String keyword : keywords) {
            if (lowerCaseQuery.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    SearchCategory withOverrides(List<String> providerOverride, Integer maxResultsOverride) {
        return new SearchCategory(
            id,
            displayName,
            description,
            providerOverride == null || providerOverride.isEmpty() ? providers : providerOverride,
            keywords,
            maxResultsOverride == null ? maxResults : maxResultsOverride
        );
    }
}
