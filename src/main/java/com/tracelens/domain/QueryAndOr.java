package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Boolean connective applied uniformly to a filter list, or between a field and its sub-filter
 */
public enum QueryAndOr {

    AND("and"),
    OR("or");

    private final String value;

    QueryAndOr(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getKeyword() {
        return name();
    }

    @JsonCreator
    public static QueryAndOr fromValue(String value) {
        for (QueryAndOr op : QueryAndOr.values()) {
            if (op.value.equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown QueryAndOr value: " + value);
    }

    /**
     * Missing connectives mean AND
     */
    public static QueryAndOr orDefault(QueryAndOr op) {
        return op != null ? op : AND;
    }
}
