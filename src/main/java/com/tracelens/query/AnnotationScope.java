package com.tracelens.query;

import com.tracelens.domain.FilterFields;

/**
 * Context needed to compile manual-feedback filters into a sub-query on the
 * annotation table paired with a span table.
 */
public final class AnnotationScope {

    private final String annotationTable;
    private final long startTime;
    private final long endTime;
    private final FilterFields rootFilters;

    public AnnotationScope(String annotationTable, long startTime, long endTime, FilterFields rootFilters) {
        this.annotationTable = annotationTable;
        this.startTime = startTime;
        this.endTime = endTime;
        this.rootFilters = rootFilters;
    }

    public String getAnnotationTable() {
        return annotationTable;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    /**
     * Top-level span filter; its space_id conditions are repeated inside the sub-query
     */
    public FilterFields getRootFilters() {
        return rootFilters;
    }
}
