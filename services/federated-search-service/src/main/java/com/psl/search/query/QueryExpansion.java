package com.psl.search.query;

import java.util.List;

public class QueryExpansion {
    private final List<String> queries;
    private final String method;
    private final String error;

    QueryExpansion(List<String> queries, String method, String error) {
        this.queries = List.copyOf(queries);
        this.method = method;
        this.error = error;
    }

    public static QueryExpansion originalOnly(String query, String error) {
        return new QueryExpansion(List.of(query), "fallback", error);
    }

    /**
     * Original query first, then the generated variations.
     */
    public List<String> getQueries() {
        return queries;
    }

    public String getMethod() {
        return method;
    }

    public String getError() {
        return error;
    }

    public boolean isExpanded() {
        return queries.size() > 1;
    }
}
