package com.tracelens.query;

import java.util.List;

/**
 * Physical columns of a span table: fixed columns followed by the tag maps.
 */
public final class SpanColumns {

    public static final List<String> ALL = List.of(
        "start_time",
        "logid",
        "span_id",
        "trace_id",
        "parent_id",
        "duration",
        "psm",
        "call_type",
        "space_id",
        "span_type",
        "span_name",
        "method",
        "status_code",
        "input",
        "output",
        "object_storage",
        "system_tags_string",
        "system_tags_long",
        "system_tags_float",
        "tags_string",
        "tags_long",
        "tags_bool",
        "tags_float",
        "tags_byte",
        "reserve_create_time",
        "logic_delete_date"
    );

    public static final String TIME_COLUMN = "start_time";

    private SpanColumns() {
    }
}
