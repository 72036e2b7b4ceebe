package com.tracelens.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Duration;

/**
 * Metrics collector for span query compilation and execution.
 * Tracks built queries by kind, rejected requests, store failures,
 * execution latency and result sizes.
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter rowQueriesBuilt;
    private Counter metricsQueriesBuilt;
    private Counter invalidRequests;
    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;

    @PostConstruct
    public void init() {
        rowQueriesBuilt = Counter.builder("tracelens.query.built")
            .description("Total number of span queries compiled")
            .tag("kind", "rows")
            .register(meterRegistry);

        metricsQueriesBuilt = Counter.builder("tracelens.query.built")
            .description("Total number of span queries compiled")
            .tag("kind", "metrics")
            .register(meterRegistry);

        invalidRequests = Counter.builder("tracelens.query.invalid")
            .description("Total number of requests rejected as invalid parameters")
            .register(meterRegistry);

        queriesExecuted = Counter.builder("tracelens.query.executed")
            .description("Total number of queries executed against the column store")
            .register(meterRegistry);

        queriesFailed = Counter.builder("tracelens.query.failed")
            .description("Total number of queries the column store failed to execute")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("tracelens.query.execution.latency")
            .description("Latency of query execution in the column store")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("tracelens.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordRowQueryBuilt() {
        rowQueriesBuilt.increment();
    }

    public void recordMetricsQueryBuilt() {
        metricsQueriesBuilt.increment();
    }

    public void recordInvalidRequest() {
        invalidRequests.increment();
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    // Getter methods for testing
    public Counter getRowQueriesBuilt() {
        return rowQueriesBuilt;
    }

    public Counter getMetricsQueriesBuilt() {
        return metricsQueriesBuilt;
    }

    public Counter getInvalidRequests() {
        return invalidRequests;
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
