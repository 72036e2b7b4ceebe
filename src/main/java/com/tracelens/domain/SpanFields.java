package com.tracelens.domain;

import java.util.Set;

/**
 * Names of span attributes stored as dedicated columns ("super fields")
 * instead of inside a tag map.
 */
public final class SpanFields {

    public static final String START_TIME = "start_time";
    public static final String SPAN_ID = "span_id";
    public static final String TRACE_ID = "trace_id";
    public static final String PARENT_ID = "parent_id";
    public static final String DURATION = "duration";
    public static final String CALL_TYPE = "call_type";
    public static final String PSM = "psm";
    public static final String LOG_ID = "logid";
    public static final String SPACE_ID = "space_id";
    public static final String SPAN_TYPE = "span_type";
    public static final String SPAN_NAME = "span_name";
    public static final String METHOD = "method";
    public static final String STATUS_CODE = "status_code";
    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String OBJECT_STORAGE = "object_storage";
    public static final String LOGIC_DELETE_DATE = "logic_delete_date";

    /**
     * Prefix of manual annotation fields, followed by the tag key id
     */
    public static final String MANUAL_FEEDBACK_PREFIX = "manual_feedback_";

    public static final Set<String> SUPER_FIELDS = Set.of(
        START_TIME, SPAN_ID, TRACE_ID, PARENT_ID, DURATION, CALL_TYPE, PSM, LOG_ID,
        SPACE_ID, SPAN_TYPE, SPAN_NAME, METHOD, STATUS_CODE, INPUT, OUTPUT,
        OBJECT_STORAGE, LOGIC_DELETE_DATE
    );

    private SpanFields() {
    }

    public static boolean isSuperField(String name) {
        return name != null && SUPER_FIELDS.contains(name);
    }
}
