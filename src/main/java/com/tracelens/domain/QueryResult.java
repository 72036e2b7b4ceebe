package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by a span query together with execution details.
 */
public class QueryResult {

    @JsonProperty("rows")
    private List<Map<String, Object>> rows;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @JsonProperty("sql")
    private String sql;

    public QueryResult() {
        this.rows = new ArrayList<>();
    }

    public QueryResult(List<Map<String, Object>> rows) {
        this.rows = rows != null ? rows : new ArrayList<>();
        this.totalCount = this.rows.size();
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    /**
     * Rendered SQL that produced these rows, for diagnostics
     */
    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }
}
