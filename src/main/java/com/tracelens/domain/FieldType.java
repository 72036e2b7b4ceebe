package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of a filtered span attribute.
 * Governs which tag map a non-super field lives in and how its values are coerced.
 */
public enum FieldType {

    STRING("string"),
    LONG("long"),
    DOUBLE("double"),
    BOOL("bool");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value to FieldType.
     * Unknown values map to STRING so newer upstream types still compile.
     */
    @JsonCreator
    public static FieldType fromValue(String value) {
        for (FieldType type : FieldType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return STRING;
    }

    /**
     * Null-safe resolution of a possibly missing type
     */
    public static FieldType orDefault(FieldType type) {
        return type != null ? type : STRING;
    }
}
