package com.psl.search.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class RouteSuggestion {
    private final String query;
    private final SearchMode mode;
    private final SearchCategory category;
    private final String reason;

    public RouteSuggestion(String query, SearchMode mode, SearchCategory category, String reason) {
        this.query = query;
        this.mode = mode;
        this.category = category;
        this.reason = reason;
    }

    public String getQuery() {
        return query;
    }

    @JsonProperty("suggested_mode")
    public String getSuggestedMode() {
        return mode.value();
    }

    @JsonProperty("detected_category")
    public String getDetectedCategory() {
        return category.getId();
    }

    @JsonProperty("category_name")
    public String getCategoryName() {
        return category.getDisplayName();
    }

    @JsonProperty("category_description")
    public String getCategoryDescription() {
        return category.getDescription();
    }

    @JsonProperty("source_hierarchy")
    public List<String> getSourceHierarchy() {
        return category.getProviders();
    }

    public String getReason() {
        return reason;
    }
}
