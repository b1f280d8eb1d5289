package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.psl.search.routing.SearchCategory;
import java.util.List;

public class CategoryView {
    private String id;
    private String name;
    private String description;
    private List<String> sources;
    private List<String> keywords;

    @JsonProperty("max_results")
    private int maxResults;

    public static CategoryView from(SearchCategory category) {
        CategoryView view = new CategoryView();
        view.id = category.getId();
        view.name = category.getDisplayName();
        view.description = category.getDescription();
        view.sources = category.getProviders();
        List<String> keywords = category.getKeywords();
        view.keywords = keywords.subList(0, Math.min(5, keywords.size()));
        view.maxResults = category.getMaxResults();
        return view;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getSources() {
        return sources;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public int getMaxResults() {
        return maxResults;
    }
}
