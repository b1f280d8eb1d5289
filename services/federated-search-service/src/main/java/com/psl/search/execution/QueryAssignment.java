package com.psl.search.execution;

import java.util.Objects;

public final class QueryAssignment {
    private final String query;
    private final String providerId;

    public QueryAssignment(String query, String providerId) {
        this.query = query;
        this.providerId = providerId;
    }

    public String getQuery() {
        return query;
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryAssignment)) {
            return false;
        }
        QueryAssignment that = (QueryAssignment) o;
        return query.equals(that.query) && providerId.equals(that.providerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, providerId);
    }

    @Override
    public String toString() {
        return providerId + ":" + query;
    }
}
