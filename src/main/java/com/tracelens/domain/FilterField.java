package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A single leaf predicate of a span filter tree.
 *
 * A field may also carry a nested {@link FilterFields} sub-tree; its own condition
 * and the sub-tree result are combined with {@link #getQueryAndOr()}. A field with an
 * empty name exists only to hold its sub-filter.
 *
 * Instances are immutable.
 */
public final class FilterField {

    @JsonProperty("field_name")
    private final String fieldName;

    @JsonProperty("field_type")
    private final FieldType fieldType;

    @JsonProperty("values")
    private final List<String> values;

    @JsonProperty("query_type")
    private final QueryType queryType;

    @JsonProperty("query_and_or")
    private final QueryAndOr queryAndOr;

    @JsonProperty("sub_filter")
    private final FilterFields subFilter;

    @JsonProperty("is_custom")
    private final boolean custom;

    @JsonProperty("is_system")
    private final boolean system;

    @JsonCreator
    public FilterField(
            @JsonProperty("field_name") String fieldName,
            @JsonProperty("field_type") FieldType fieldType,
            @JsonProperty("values") List<String> values,
            @JsonProperty("query_type") QueryType queryType,
            @JsonProperty("query_and_or") QueryAndOr queryAndOr,
            @JsonProperty("sub_filter") FilterFields subFilter,
            @JsonProperty("is_custom") boolean custom,
            @JsonProperty("is_system") boolean system) {
        this.fieldName = fieldName != null ? fieldName : "";
        this.fieldType = fieldType;
        this.values = values != null
            ? Collections.unmodifiableList(new ArrayList<>(values))
            : Collections.emptyList();
        this.queryType = queryType;
        this.queryAndOr = queryAndOr;
        this.subFilter = subFilter;
        this.custom = custom;
        this.system = system;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * Declared type, or null when the producer did not send one
     */
    public FieldType getFieldType() {
        return fieldType;
    }

    public List<String> getValues() {
        return values;
    }

    public QueryType getQueryType() {
        return queryType;
    }

    public QueryAndOr getQueryAndOr() {
        return queryAndOr;
    }

    public FilterFields getSubFilter() {
        return subFilter;
    }

    public boolean isCustom() {
        return custom;
    }

    public boolean isSystem() {
        return system;
    }

    public boolean hasFieldName() {
        return !fieldName.isEmpty();
    }

    @Override
    public String toString() {
        return "FilterField{" + fieldName + " " + queryType + " " + values + "}";
    }

    /**
     * Builder for FilterField
     */
    public static final class Builder {
        private String fieldName;
        private FieldType fieldType;
        private List<String> values;
        private QueryType queryType;
        private QueryAndOr queryAndOr;
        private FilterFields subFilter;
        private boolean custom;
        private boolean system;

        private Builder() {
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder fieldType(FieldType fieldType) {
            this.fieldType = fieldType;
            return this;
        }

        public Builder values(List<String> values) {
            this.values = values;
            return this;
        }

        public Builder values(String... values) {
            this.values = Arrays.asList(values);
            return this;
        }

        public Builder queryType(QueryType queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder queryAndOr(QueryAndOr queryAndOr) {
            this.queryAndOr = queryAndOr;
            return this;
        }

        public Builder subFilter(FilterFields subFilter) {
            this.subFilter = subFilter;
            return this;
        }

        public Builder custom(boolean custom) {
            this.custom = custom;
            return this;
        }

        public Builder system(boolean system) {
            this.system = system;
            return this;
        }

        public FilterField build() {
            return new FilterField(fieldName, fieldType, values, queryType, queryAndOr, subFilter, custom, system);
        }
    }
}
