package com.psl.search.service;

import com.psl.search.api.dto.AggregateSearchRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AggregateSearchCommand {
    private final String query;
    private final String category;
    private final String mode;
    private final Integer limit;
    private final List<String> sources;
    private final String rankBy;
    private final boolean useCache;

    public AggregateSearchCommand(
        String query,
        String category,
        String mode,
        Integer limit,
        List<String> sources,
        String rankBy,
        boolean useCache
    ) {
        this.query = query;
        this.category = category;
        this.mode = mode;
        this.limit = limit;
        // may hold nulls from a malformed body; validation rejects them
        this.sources = sources == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sources));
        this.rankBy = rankBy;
        this.useCache = useCache;
    }

    public static AggregateSearchCommand of(String query) {
        return new AggregateSearchCommand(query, null, null, null, null, null, true);
    }

    public static AggregateSearchCommand from(AggregateSearchRequest request) {
        return new AggregateSearchCommand(
            request.getQuery(),
            blankToNull(request.getCategory()),
            blankToNull(request.getMode()),
            request.getLimit(),
            request.getSources(),
            request.getRankBy(),
            request.getUseCache() == null || request.getUseCache()
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String getQuery() {
        return query;
    }

    public String getCategory() {
        return category;
    }

    public String getMode() {
        return mode;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getSources() {
        return sources;
    }

    public String getRankBy() {
        return rankBy;
    }

    public boolean isUseCache() {
        return useCache;
    }
}
