package com.tracelens.query;

import java.util.List;

/**
 * Exception thrown when the column store fails to execute a compiled query.
 * Carries the targeted tables and the rendered SQL; unlike
 * {@link InvalidQueryParameterException} the failure is worth retrying.
 */
public class QueryExecutionException extends RuntimeException {

    private final List<String> tables;
    private final String query;

    public QueryExecutionException(String message, List<String> tables, String query, Throwable cause) {
        super(message, cause);
        this.tables = tables;
        this.query = query;
    }

    public List<String> getTables() {
        return tables;
    }

    public String getQuery() {
        return query;
    }

    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (tables != null && !tables.isEmpty()) {
            sb.append(" [Tables: ").append(String.join(", ", tables)).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
