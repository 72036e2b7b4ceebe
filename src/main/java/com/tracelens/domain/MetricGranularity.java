package com.tracelens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-bucket width used when aggregating spans into a time series.
 */
public enum MetricGranularity {

    ONE_MINUTE("1min", Duration.ofMinutes(1), "INTERVAL 1 MINUTE"),
    FIVE_MINUTES("5min", Duration.ofMinutes(5), "INTERVAL 5 MINUTE"),
    FIFTEEN_MINUTES("15min", Duration.ofMinutes(15), "INTERVAL 15 MINUTE"),
    ONE_HOUR("1hour", Duration.ofHours(1), "INTERVAL 1 HOUR"),
    ONE_DAY("1day", Duration.ofDays(1), "INTERVAL 1 DAY"),
    // weekly reports are still bucketed per day
    ONE_WEEK("1week", Duration.ofDays(1), "INTERVAL 1 DAY");

    public static final MetricGranularity DEFAULT = FIVE_MINUTES;

    private final String value;
    private final Duration bucketWidth;
    private final String interval;

    MetricGranularity(String value, Duration bucketWidth, String interval) {
        this.value = value;
        this.bucketWidth = bucketWidth;
        this.interval = interval;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getBucketWidth() {
        return bucketWidth;
    }

    /**
     * ClickHouse interval literal for toStartOfInterval
     */
    public String getInterval() {
        return interval;
    }

    /**
     * Parse a wire value.
     *
     * @return null for a missing or blank value (no bucketing), {@link #DEFAULT} for an unknown one
     */
    @JsonCreator
    public static MetricGranularity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (MetricGranularity granularity : MetricGranularity.values()) {
            if (granularity.value.equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        return DEFAULT;
    }

    /**
     * Enumerate the bucket start times (epoch millis) covering [startMillis, endMillis].
     * Day-wide buckets start at midnight in the given zone; narrower ones are aligned to
     * multiples of the bucket width.
     */
    public List<Long> bucketStarts(long startMillis, long endMillis, ZoneId zone) {
        long widthMillis = bucketWidth.toMillis();
        long bucket;
        if (bucketWidth.compareTo(Duration.ofDays(1)) >= 0) {
            bucket = ZonedDateTime.ofInstant(Instant.ofEpochMilli(startMillis), zone)
                .truncatedTo(ChronoUnit.DAYS)
                .toInstant()
                .toEpochMilli();
        } else {
            bucket = startMillis - Math.floorMod(startMillis, widthMillis);
        }
        List<Long> buckets = new ArrayList<>();
        while (bucket <= endMillis) {
            buckets.add(bucket);
            bucket += widthMillis;
        }
        return buckets;
    }
}
