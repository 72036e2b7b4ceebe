package com.tracelens.domain;

/**
 * One projected column of a metrics query: either an aggregation or a group-by field,
 * with an optional output alias.
 */
public final class Dimension {

    private final AggregationExpression expression;
    private final FilterField field;
    private final String alias;

    private Dimension(AggregationExpression expression, FilterField field, String alias) {
        this.expression = expression;
        this.field = field;
        this.alias = alias;
    }

    public static Dimension aggregation(AggregationExpression expression, String alias) {
        return new Dimension(expression, null, alias);
    }

    public static Dimension groupBy(FilterField field, String alias) {
        return new Dimension(null, field, alias);
    }

    public AggregationExpression getExpression() {
        return expression;
    }

    public FilterField getField() {
        return field;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null && !alias.isEmpty();
    }
}
