package com.tracelens.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A SQL aggregation template such as {@code countIf(%s = 0)}.
 * Each {@code %s} is replaced, in order, by the column resolved for the matching field;
 * {@code %%} stands for a literal {@code %}.
 */
public final class AggregationExpression {

    private final String template;
    private final List<FilterField> fields;

    public AggregationExpression(String template, List<FilterField> fields) {
        this.template = template;
        List<FilterField> referenced = new ArrayList<>();
        if (fields != null) {
            for (FilterField field : fields) {
                if (field != null) {
                    referenced.add(field);
                }
            }
        }
        this.fields = Collections.unmodifiableList(referenced);
    }

    public static AggregationExpression of(String template, FilterField... fields) {
        return new AggregationExpression(template, Arrays.asList(fields));
    }

    public String getTemplate() {
        return template;
    }

    public List<FilterField> getFields() {
        return fields;
    }
}
