package com.tracelens.query;

import com.tracelens.domain.Dimension;
import com.tracelens.domain.FilterFields;
import com.tracelens.domain.MetricGranularity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Request for aggregated span metrics, optionally bucketed into a time series.
 * The time range only applies when both bounds are positive.
 */
public final class GetMetricsParam {

    private final List<String> tables;
    private final List<Dimension> aggregations;
    private final List<Dimension> groupBys;
    private final FilterFields filters;
    private final long startAt;
    private final long endAt;
    private final MetricGranularity granularity;

    private GetMetricsParam(Builder builder) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(builder.tables));
        this.aggregations = Collections.unmodifiableList(new ArrayList<>(builder.aggregations));
        this.groupBys = Collections.unmodifiableList(new ArrayList<>(builder.groupBys));
        this.filters = builder.filters;
        this.startAt = builder.startAt;
        this.endAt = builder.endAt;
        this.granularity = builder.granularity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getTables() {
        return tables;
    }

    public List<Dimension> getAggregations() {
        return aggregations;
    }

    public List<Dimension> getGroupBys() {
        return groupBys;
    }

    public FilterFields getFilters() {
        return filters;
    }

    public long getStartAt() {
        return startAt;
    }

    public long getEndAt() {
        return endAt;
    }

    /**
     * Bucket width, or null for a single aggregate row per group
     */
    public MetricGranularity getGranularity() {
        return granularity;
    }

    /**
     * Builder for GetMetricsParam
     */
    public static final class Builder {
        private List<String> tables = new ArrayList<>();
        private final List<Dimension> aggregations = new ArrayList<>();
        private final List<Dimension> groupBys = new ArrayList<>();
        private FilterFields filters;
        private long startAt;
        private long endAt;
        private MetricGranularity granularity;

        private Builder() {
        }

        public Builder tables(List<String> tables) {
            this.tables = tables != null ? tables : new ArrayList<>();
            return this;
        }

        public Builder tables(String... tables) {
            return tables(Arrays.asList(tables));
        }

        public Builder aggregation(Dimension aggregation) {
            this.aggregations.add(aggregation);
            return this;
        }

        public Builder groupBy(Dimension groupBy) {
            this.groupBys.add(groupBy);
            return this;
        }

        public Builder filters(FilterFields filters) {
            this.filters = filters;
            return this;
        }

        public Builder timeRange(long startAt, long endAt) {
            this.startAt = startAt;
            this.endAt = endAt;
            return this;
        }

        public Builder granularity(MetricGranularity granularity) {
            this.granularity = granularity;
            return this;
        }

        /**
         * Lenient wire form: blank means none, unknown means the default bucket
         */
        public Builder granularity(String granularity) {
            this.granularity = MetricGranularity.fromValue(granularity);
            return this;
        }

        public GetMetricsParam build() {
            return new GetMetricsParam(this);
        }
    }
}
