package com.formdb.index.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Reductions supported over a time-series range.
 */
public enum Aggregation {
    NONE,
    AVG,
    MIN,
    MAX,
    SUM,
    COUNT;

    public static Aggregation fromName(String name) {
        if (name == null || name.isBlank()) {
            return NONE;
        }
        return Arrays.stream(values())
                .filter(aggregation -> aggregation.name().equalsIgnoreCase(name.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation: " + name));
    }

    /**
     * Applies the reduction. {@link #NONE} has no scalar value; empty input yields empty
     * for every reduction except {@link #COUNT}.
     */
    public OptionalDouble apply(List<TimePoint> points) {
        return switch (this) {
            case NONE -> OptionalDouble.empty();
            case AVG -> points.stream().mapToDouble(TimePoint::value).average();
            case MIN -> points.stream().mapToDouble(TimePoint::value).min();
            case MAX -> points.stream().mapToDouble(TimePoint::value).max();
            case SUM -> points.isEmpty()
                    ? OptionalDouble.empty()
                    : OptionalDouble.of(points.stream().mapToDouble(TimePoint::value).sum());
            case COUNT -> OptionalDouble.of(points.size());
        };
    }
}
