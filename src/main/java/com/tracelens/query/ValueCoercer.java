package com.tracelens.query;

import com.tracelens.domain.FieldType;
import com.tracelens.domain.FilterField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts the string-encoded values of a filter field into typed bind values.
 */
@Component
public class ValueCoercer {

    // plain base-10 ASCII numerals, no whitespace, type suffixes or hex
    private static final Pattern INT64 = Pattern.compile("^[+-]?[0-9]+$");
    private static final Pattern FLOAT64 =
        Pattern.compile("^[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?$");

    public List<Object> coerce(FilterField field) {
        List<Object> result = new ArrayList<>(field.getValues().size());
        FieldType type = FieldType.orDefault(field.getFieldType());
        for (String value : field.getValues()) {
            result.add(coerceValue(type, value));
        }
        return result;
    }

    /**
     * Value a tag map returns for a missing key; exist/not_exist compare against it
     */
    public Object zeroValue(FieldType type) {
        switch (FieldType.orDefault(type)) {
            case LONG:
            case BOOL:
                return 0L;
            case DOUBLE:
                return 0.0d;
            default:
                return "";
        }
    }

    private Object coerceValue(FieldType type, String value) {
        switch (type) {
            case LONG:
                if (value == null || !INT64.matcher(value).matches()) {
                    throw new InvalidQueryParameterException(
                        "fail to convert field value " + value + " to int64");
                }
                try {
                    return Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new InvalidQueryParameterException(
                        "fail to convert field value " + value + " to int64", e);
                }
            case DOUBLE:
                if (value == null || !FLOAT64.matcher(value).matches()) {
                    throw new InvalidQueryParameterException(
                        "fail to convert field value " + value + " to float64");
                }
                double parsed;
                try {
                    parsed = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new InvalidQueryParameterException(
                        "fail to convert field value " + value + " to float64", e);
                }
                if (!Double.isFinite(parsed)) {
                    throw new InvalidQueryParameterException(
                        "field value " + value + " is not a finite number");
                }
                return parsed;
            case BOOL:
                return "true".equals(value) ? 1L : 0L;
            default:
                return value;
        }
    }
}
