package com.tracelens.query;

import com.tracelens.domain.FilterFields;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request for span rows over one or more span tables.
 * Start and end are inclusive microsecond epochs; a negative limit means unbounded.
 */
public final class QueryParam {

    private final List<String> tables;
    private final long startTime;
    private final long endTime;
    private final FilterFields filters;
    private final int limit;
    private final boolean orderByStartTime;
    private final List<String> selectColumns;
    private final List<String> omitColumns;
    private final Map<String, String> annotationTables;

    private QueryParam(Builder builder) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(builder.tables));
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.filters = builder.filters;
        this.limit = builder.limit;
        this.orderByStartTime = builder.orderByStartTime;
        this.selectColumns = Collections.unmodifiableList(new ArrayList<>(builder.selectColumns));
        this.omitColumns = Collections.unmodifiableList(new ArrayList<>(builder.omitColumns));
        this.annotationTables = Collections.unmodifiableMap(new HashMap<>(builder.annotationTables));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Target tables, highest priority first
     */
    public List<String> getTables() {
        return tables;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public FilterFields getFilters() {
        return filters;
    }

    public int getLimit() {
        return limit;
    }

    public boolean isOrderByStartTime() {
        return orderByStartTime;
    }

    /**
     * Explicit projection; empty means every span column
     */
    public List<String> getSelectColumns() {
        return selectColumns;
    }

    public List<String> getOmitColumns() {
        return omitColumns;
    }

    /**
     * Annotation table paired with each span table, used by manual-feedback filters
     */
    public Map<String, String> getAnnotationTables() {
        return annotationTables;
    }

    /**
     * Builder for QueryParam
     */
    public static final class Builder {
        private List<String> tables = new ArrayList<>();
        private long startTime;
        private long endTime;
        private FilterFields filters;
        private int limit = -1;
        private boolean orderByStartTime;
        private List<String> selectColumns = new ArrayList<>();
        private List<String> omitColumns = new ArrayList<>();
        private Map<String, String> annotationTables = new HashMap<>();

        private Builder() {
        }

        public Builder tables(List<String> tables) {
            this.tables = tables != null ? tables : new ArrayList<>();
            return this;
        }

        public Builder tables(String... tables) {
            return tables(Arrays.asList(tables));
        }

        public Builder timeRange(long startTime, long endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        public Builder filters(FilterFields filters) {
            this.filters = filters;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder orderByStartTime(boolean orderByStartTime) {
            this.orderByStartTime = orderByStartTime;
            return this;
        }

        public Builder selectColumns(List<String> selectColumns) {
            this.selectColumns = selectColumns != null ? selectColumns : new ArrayList<>();
            return this;
        }

        public Builder omitColumns(List<String> omitColumns) {
            this.omitColumns = omitColumns != null ? omitColumns : new ArrayList<>();
            return this;
        }

        public Builder omitColumns(String... omitColumns) {
            return omitColumns(Arrays.asList(omitColumns));
        }

        public Builder annotationTable(String spanTable, String annotationTable) {
            this.annotationTables.put(spanTable, annotationTable);
            return this;
        }

        public QueryParam build() {
            return new QueryParam(this);
        }
    }
}
