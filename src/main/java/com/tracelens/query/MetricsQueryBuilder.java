package com.tracelens.query;

import com.tracelens.domain.AggregationExpression;
import com.tracelens.domain.Dimension;
import com.tracelens.domain.FilterField;
import com.tracelens.domain.MetricGranularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles aggregate queries over span tables.
 *
 * SELECT holds the optional time bucket, then each aggregation, then each group-by.
 * Time-series output (granularity set) is grouped and ordered by the bucket.
 */
@Component
public class MetricsQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MetricsQueryBuilder.class);

    public static final String TIME_BUCKET = "time_bucket";

    private final PredicateCompiler predicateCompiler;
    private final ColumnResolver columnResolver;

    public MetricsQueryBuilder(PredicateCompiler predicateCompiler, ColumnResolver columnResolver) {
        this.predicateCompiler = predicateCompiler;
        this.columnResolver = columnResolver;
    }

    /**
     * Build the aggregate query for a request
     *
     * @throws InvalidQueryParameterException when no table is configured or any dimension or filter is invalid
     */
    public SpanQuery build(GetMetricsParam param) {
        if (param.getTables().isEmpty()) {
            throw new InvalidQueryParameterException("no table configured");
        }

        List<String> selectClauses = new ArrayList<>();
        List<String> groupByClauses = new ArrayList<>();
        MetricGranularity granularity = param.getGranularity();
        if (granularity != null) {
            selectClauses.add(bucketExpression(granularity) + " AS " + TIME_BUCKET);
            groupByClauses.add(TIME_BUCKET);
        }
        for (Dimension dimension : param.getAggregations()) {
            selectClauses.add(aliased(formatAggregation(dimension), dimension));
        }
        for (Dimension dimension : param.getGroupBys()) {
            if (dimension.getField() == null) {
                throw new InvalidQueryParameterException("group-by dimension has no field");
            }
            String column = columnResolver.resolve(dimension.getField());
            selectClauses.add(aliased(column, dimension));
            groupByClauses.add(dimension.hasAlias() ? dimension.getAlias() : column);
        }
        if (selectClauses.isEmpty()) {
            throw new InvalidQueryParameterException("no aggregation or group-by requested");
        }

        List<SqlFragment> conditions = new ArrayList<>(3);
        if (param.getStartAt() > 0 && param.getEndAt() > 0) {
            conditions.add(SqlFragment.of(SpanColumns.TIME_COLUMN + " >= ?", param.getStartAt()));
            conditions.add(SqlFragment.of(SpanColumns.TIME_COLUMN + " <= ?", param.getEndAt()));
        }
        SqlFragment predicate = predicateCompiler.compile(param.getFilters());
        if (!predicate.isAlwaysTrue()) {
            conditions.add(predicate);
        }

        StringBuilder suffix = new StringBuilder();
        if (!groupByClauses.isEmpty()) {
            suffix.append(" GROUP BY ").append(String.join(", ", groupByClauses));
        }
        if (granularity != null) {
            suffix.append(" ORDER BY ").append(TIME_BUCKET);
        }

        String head = "SELECT " + String.join(", ", selectClauses) + " FROM " + fromClause(param.getTables());
        SqlFragment statement;
        if (conditions.isEmpty()) {
            statement = SqlFragment.of(head + suffix);
        } else {
            statement = SqlFragment.list(conditions, " AND ").wrap(head + " WHERE ", suffix.toString());
        }
        logger.debug("Built metrics query with {} aggregations and {} group-bys",
            param.getAggregations().size(), param.getGroupBys().size());
        return new SpanQuery(statement, param.getTables());
    }

    static String bucketExpression(MetricGranularity granularity) {
        return "toUnixTimestamp(toStartOfInterval(fromUnixTimestamp64Micro(" + SpanColumns.TIME_COLUMN + "), "
            + granularity.getInterval() + ")) * 1000";
    }

    private static String fromClause(List<String> tables) {
        if (tables.size() == 1) {
            return SqlLiterals.quoteTable(tables.get(0));
        }
        List<String> selects = new ArrayList<>(tables.size());
        for (String table : tables) {
            selects.add("SELECT * FROM " + SqlLiterals.quoteTable(table));
        }
        return "(" + String.join(" UNION ALL ", selects) + ")";
    }

    private static String aliased(String expression, Dimension dimension) {
        if (!dimension.hasAlias()) {
            return expression;
        }
        return expression + " AS " + SqlLiterals.requireIdentifier(dimension.getAlias(), "alias");
    }

    /**
     * Substitute resolved columns into the template's placeholders, in order.
     * {@code %s} takes the next field and {@code %%} is a literal percent sign.
     */
    private String formatAggregation(Dimension dimension) {
        AggregationExpression expression = dimension.getExpression();
        if (expression == null || expression.getTemplate() == null || expression.getTemplate().isEmpty()) {
            throw new InvalidQueryParameterException("aggregation dimension has no expression");
        }
        String template = expression.getTemplate();
        List<FilterField> fields = expression.getFields();

        StringBuilder sql = new StringBuilder(template.length() + fields.size() * 16);
        int used = 0;
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            char next = i + 1 < template.length() ? template.charAt(i + 1) : 0;
            if (c == '%' && next == '%') {
                sql.append('%');
                i++;
            } else if (c == '%' && next == 's') {
                if (used >= fields.size()) {
                    throw new InvalidQueryParameterException(
                        "aggregation " + template + " has more placeholders than fields");
                }
                sql.append(columnResolver.resolve(fields.get(used++)));
                i++;
            } else {
                sql.append(c);
            }
        }
        if (used != fields.size()) {
            throw new InvalidQueryParameterException(
                "aggregation " + template + " references " + fields.size() + " fields but has " + used + " placeholders");
        }
        return sql.toString();
    }
}
