package com.tracelens.storage;

import com.tracelens.domain.QueryResult;
import com.tracelens.query.GetMetricsParam;
import com.tracelens.query.InvalidQueryParameterException;
import com.tracelens.query.MetricsQueryBuilder;
import com.tracelens.query.QueryExecutionException;
import com.tracelens.query.QueryMetrics;
import com.tracelens.query.QueryParam;
import com.tracelens.query.SpanQuery;
import com.tracelens.query.SpanQueryBuilder;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs compiled span queries against the ClickHouse span tables.
 *
 * Compilation failures surface as {@link InvalidQueryParameterException} before the
 * store is touched; store failures are wrapped in {@link QueryExecutionException}.
 */
@Repository
public class SpanRepository {
    private static final Logger logger = LoggerFactory.getLogger(SpanRepository.class);

    private final JdbcOperations jdbcTemplate;
    private final SpanQueryBuilder spanQueryBuilder;
    private final MetricsQueryBuilder metricsQueryBuilder;
    private final QueryMetrics metrics;

    public SpanRepository(
            @Qualifier("clickHouseJdbcTemplate") JdbcOperations jdbcTemplate,
            SpanQueryBuilder spanQueryBuilder,
            MetricsQueryBuilder metricsQueryBuilder,
            QueryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.spanQueryBuilder = spanQueryBuilder;
        this.metricsQueryBuilder = metricsQueryBuilder;
        this.metrics = metrics;
    }

    /**
     * Fetch span rows matching the request
     */
    public QueryResult get(QueryParam param) {
        SpanQuery query = compile(() -> spanQueryBuilder.build(param), "invalid get trace request");
        metrics.recordRowQueryBuilt();
        String debugSql = query.toDebugSql();
        logger.info("Get Trace SQL: {}", debugSql);

        long startQuery = System.currentTimeMillis();
        List<Map<String, Object>> rows = execute(query, debugSql);
        long duration = System.currentTimeMillis() - startQuery;

        QueryResult result = new QueryResult(rows);
        result.setExecutionTimeMs(duration);
        result.setSql(debugSql);

        logger.debug("Span query returned {} rows in {} ms", rows.size(), duration);
        return result;
    }

    /**
     * Fetch aggregated rows, one per bucket and group
     */
    public List<Map<String, Object>> getMetrics(GetMetricsParam param) {
        SpanQuery query = compile(() -> metricsQueryBuilder.build(param), "invalid build metric request");
        metrics.recordMetricsQueryBuilt();
        String debugSql = query.toDebugSql();
        logger.info("Get Metrics SQL: {}", debugSql);
        return execute(query, debugSql);
    }

    private SpanQuery compile(Supplier<SpanQuery> builder, String context) {
        try {
            return builder.get();
        } catch (InvalidQueryParameterException e) {
            metrics.recordInvalidRequest();
            logger.warn("{}: {}", context, e.getMessage());
            throw new InvalidQueryParameterException(context + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> execute(SpanQuery query, String debugSql) {
        Timer.Sample sample = metrics.startQueryTimer();
        try {
            List<Map<String, Object>> rows = query.queryForList(jdbcTemplate);
            metrics.recordQueryExecuted();
            metrics.recordResultSize(rows.size());
            return rows;
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            logger.error("Span query failed on tables {}: {}", query.getTables(), e.getMessage(), e);
            throw new QueryExecutionException("Failed to execute span query", query.getTables(), debugSql, e);
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }
}
