package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * An ordered list of filter fields joined by one connective.
 *
 * The connective applies to every element: all are OR-joined when it is OR,
 * otherwise all are AND-joined. Mixing connectives requires nesting through
 * {@link FilterField#getSubFilter()}.
 */
public final class FilterFields {

    @JsonProperty("query_and_or")
    private final QueryAndOr queryAndOr;

    @JsonProperty("filter_fields")
    private final List<FilterField> filterFields;

    @JsonCreator
    public FilterFields(
            @JsonProperty("query_and_or") QueryAndOr queryAndOr,
            @JsonProperty("filter_fields") List<FilterField> filterFields) {
        this.queryAndOr = queryAndOr;
        this.filterFields = filterFields != null
            ? Collections.unmodifiableList(new ArrayList<>(filterFields))
            : Collections.emptyList();
    }

    public static FilterFields and(FilterField... fields) {
        return new FilterFields(QueryAndOr.AND, Arrays.asList(fields));
    }

    public static FilterFields or(FilterField... fields) {
        return new FilterFields(QueryAndOr.OR, Arrays.asList(fields));
    }

    public QueryAndOr getQueryAndOr() {
        return queryAndOr;
    }

    public List<FilterField> getFilterFields() {
        return filterFields;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return filterFields.isEmpty();
    }

    /**
     * Visit every leaf depth-first, descending into sub-filters after their owner
     */
    public void traverse(Consumer<FilterField> visitor) {
        for (FilterField field : filterFields) {
            if (field == null) {
                continue;
            }
            visitor.accept(field);
            if (field.getSubFilter() != null) {
                field.getSubFilter().traverse(visitor);
            }
        }
    }
}
