package com.tracelens.query;

import com.tracelens.domain.FilterField;
import com.tracelens.domain.SpanFields;
import org.springframework.stereotype.Component;

/**
 * Maps a logical span field to the physical column reference used in SQL.
 *
 * Super fields resolve to their dedicated column. Everything else is an index into a
 * typed tag map chosen by field type and the custom/system flags; custom wins when both
 * flags are set. Tag keys are interpolated into SQL text, so they must be plain identifiers.
 */
@Component
public class ColumnResolver {

    public String resolve(FilterField field) {
        String name = field.getFieldName();
        if (SpanFields.isSuperField(name)) {
            return SqlLiterals.quoteIdentifier(name);
        }
        if (!SqlLiterals.isSafeIdentifier(name)) {
            throw new InvalidQueryParameterException("filter field name " + name + " is not safe");
        }
        return familyOf(field).index(name);
    }

    ColumnFamily familyOf(FilterField field) {
        if (field.isCustom()) {
            return ColumnFamily.userFamily(field.getFieldType());
        }
        if (field.isSystem()) {
            return ColumnFamily.systemFamily(field.getFieldType());
        }
        return ColumnFamily.userFamily(field.getFieldType());
    }
}
