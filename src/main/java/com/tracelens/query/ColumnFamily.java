package com.tracelens.query;

import com.tracelens.domain.FieldType;

/**
 * Typed tag-map columns that hold span attributes not promoted to super fields.
 */
public enum ColumnFamily {

    TAGS_STRING("tags_string"),
    TAGS_LONG("tags_long"),
    TAGS_FLOAT("tags_float"),
    TAGS_BOOL("tags_bool"),
    SYSTEM_TAGS_STRING("system_tags_string"),
    SYSTEM_TAGS_LONG("system_tags_long"),
    SYSTEM_TAGS_FLOAT("system_tags_float");

    private final String column;

    ColumnFamily(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    /**
     * Map-index expression addressing one key of this family.
     * The key must already be a validated identifier.
     */
    public String index(String key) {
        return column + "['" + key + "']";
    }

    public static ColumnFamily userFamily(FieldType type) {
        switch (FieldType.orDefault(type)) {
            case LONG:
                return TAGS_LONG;
            case DOUBLE:
                return TAGS_FLOAT;
            case BOOL:
                return TAGS_BOOL;
            default:
                return TAGS_STRING;
        }
    }

    /**
     * System tags have no bool map; bools fall back to the string family
     */
    public static ColumnFamily systemFamily(FieldType type) {
        switch (FieldType.orDefault(type)) {
            case LONG:
                return SYSTEM_TAGS_LONG;
            case DOUBLE:
                return SYSTEM_TAGS_FLOAT;
            default:
                return SYSTEM_TAGS_STRING;
        }
    }
}
