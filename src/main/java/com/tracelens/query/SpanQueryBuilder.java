package com.tracelens.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles row queries over one or more span tables.
 *
 * Each table gets its own filtered, time-bounded, ordered and limited SELECT. Several
 * tables are combined with UNION ALL under one outer ORDER BY and LIMIT, so the limit
 * applies both per table and to the merged result.
 */
@Component
public class SpanQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SpanQueryBuilder.class);

    static final String ORDER_BY_START_TIME = " ORDER BY start_time DESC, span_id DESC";

    private final PredicateCompiler predicateCompiler;

    public SpanQueryBuilder(PredicateCompiler predicateCompiler) {
        this.predicateCompiler = predicateCompiler;
    }

    /**
     * Build the row query for a request
     *
     * @throws InvalidQueryParameterException when no table is configured or the filter is invalid
     */
    public SpanQuery build(QueryParam param) {
        if (param.getTables().isEmpty()) {
            throw new InvalidQueryParameterException("no table configured");
        }
        String columns = projection(param);

        List<SqlFragment> tableQueries = new ArrayList<>(param.getTables().size());
        for (String table : param.getTables()) {
            tableQueries.add(buildSingle(table, columns, param));
        }
        if (tableQueries.size() == 1) {
            return new SpanQuery(tableQueries.get(0), param.getTables());
        }

        List<SqlFragment> wrapped = new ArrayList<>(tableQueries.size());
        for (SqlFragment tableQuery : tableQueries) {
            wrapped.add(tableQuery.wrap("(", ")"));
        }
        SqlFragment union = SqlFragment.list(wrapped, " UNION ALL ")
            .wrap("SELECT * FROM (", ")" + orderAndLimit(param));
        logger.debug("Built union span query over {} tables", tableQueries.size());
        return new SpanQuery(union, param.getTables());
    }

    private SqlFragment buildSingle(String table, String columns, QueryParam param) {
        AnnotationScope scope = null;
        String annotationTable = param.getAnnotationTables().get(table);
        if (annotationTable != null) {
            scope = new AnnotationScope(annotationTable, param.getStartTime(), param.getEndTime(), param.getFilters());
        }
        SqlFragment predicate = predicateCompiler.compile(param.getFilters(), scope);

        List<SqlFragment> conditions = new ArrayList<>(3);
        if (!predicate.isAlwaysTrue()) {
            conditions.add(predicate);
        }
        conditions.add(SqlFragment.of(SpanColumns.TIME_COLUMN + " >= ?", param.getStartTime()));
        conditions.add(SqlFragment.of(SpanColumns.TIME_COLUMN + " <= ?", param.getEndTime()));

        return SqlFragment.list(conditions, " AND ").wrap(
            "SELECT " + columns + " FROM " + SqlLiterals.quoteTable(table) + " WHERE ",
            orderAndLimit(param));
    }

    private static String orderAndLimit(QueryParam param) {
        StringBuilder sql = new StringBuilder();
        if (param.isOrderByStartTime()) {
            sql.append(ORDER_BY_START_TIME);
        }
        if (param.getLimit() >= 0) {
            sql.append(" LIMIT ").append(param.getLimit());
        }
        return sql.toString();
    }

    /**
     * Explicit columns or every span column, minus the omitted ones
     */
    private static String projection(QueryParam param) {
        List<String> source = param.getSelectColumns().isEmpty() ? SpanColumns.ALL : param.getSelectColumns();
        Set<String> omit = new HashSet<>(param.getOmitColumns());
        Set<String> columns = new LinkedHashSet<>();
        for (String column : source) {
            SqlLiterals.requireIdentifier(column, "select column");
            if (!omit.contains(column)) {
                columns.add(column);
            }
        }
        if (columns.isEmpty()) {
            throw new InvalidQueryParameterException("no column left to select");
        }
        return String.join(", ", columns);
    }
}
