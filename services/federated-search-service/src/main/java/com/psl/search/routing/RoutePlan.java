package com.psl.search.routing;

import java.util.List;

public class RoutePlan {
    private final SearchCategory category;
    private final SearchMode mode;
    private final boolean categoryInferred;
    private final boolean modeInferred;

    public RoutePlan(SearchCategory category, SearchMode mode, boolean categoryInferred, boolean modeInferred) {
        this.category = category;
        this.mode = mode;
        this.categoryInferred = categoryInferred;
        this.modeInferred = modeInferred;
    }

    public SearchCategory getCategory() {
        return category;
    }

    public String getCategoryId() {
        return category.getId();
    }

    public SearchMode getMode() {
        return mode;
    }

    public List<String> getProviders() {
        return category.getProviders();
    }

    public int getMaxResults() {
        return category.getMaxResults();
    }

    public boolean isCategoryInferred() {
        return categoryInferred;
    }

    public boolean isModeInferred() {
        return modeInferred;
    }
}
