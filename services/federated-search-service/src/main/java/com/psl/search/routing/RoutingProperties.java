package com.psl.search.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.routing")
public class RoutingProperties {
    private String defaultCategory = CategoryCatalog.GENERAL;
    private int expandTokenThreshold = 6;
    private Map<String, CategoryOverride> categories = new LinkedHashMap<>();

    public String getDefaultCategory() {
        return defaultCategory;
    }

    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public int getExpandTokenThreshold() {
        return expandTokenThreshold;
    }

    public void setExpandTokenThreshold(int expandTokenThreshold) {
        this.expandTokenThreshold = expandTokenThreshold;
    }

    public Map<String, CategoryOverride> getCategories() {
        return categories;
    }

    public void setCategories(Map<String, CategoryOverride> categories) {
        this.categories = categories;
    }

    public static class CategoryOverride {
        private List<String> providers;
        private Integer maxResults;

        public List<String> getProviders() {
            return providers;
        }

        public void setProviders(List<String> providers) {
            this.providers = providers;
        }

        public Integer getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(Integer maxResults) {
            this.maxResults = maxResults;
        }
    }
}
