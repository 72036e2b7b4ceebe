package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Filter operators supported on a single span field.
 * Each operator declares how many values it accepts.
 */
public enum QueryType {

    MATCH("match", Arity.SINGLE),
    NOT_MATCH("not_match", Arity.SINGLE),
    EQ("eq", Arity.SINGLE),
    NOT_EQ("not_eq", Arity.SINGLE),
    LT("lt", Arity.SINGLE),
    LTE("lte", Arity.SINGLE),
    GT("gt", Arity.SINGLE),
    GTE("gte", Arity.SINGLE),
    EXIST("exist", Arity.NONE),
    NOT_EXIST("not_exist", Arity.NONE),
    IN("in", Arity.AT_LEAST_ONE),
    NOT_IN("not_in", Arity.AT_LEAST_ONE),
    ALWAYS_TRUE("always_true", Arity.NONE);

    /**
     * Number of values an operator consumes
     */
    public enum Arity {
        SINGLE,
        AT_LEAST_ONE,
        NONE
    }

    private final String value;
    private final Arity arity;

    QueryType(String value, Arity arity) {
        this.value = value;
        this.arity = arity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Arity getArity() {
        return arity;
    }

    @JsonCreator
    public static QueryType fromValue(String value) {
        for (QueryType type : QueryType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown QueryType value: " + value);
    }
}
