package com.formdb.index.domain.model;

public record TimeSeriesAggregate(
        String seriesId,
        Aggregation aggregation,
        long start,
        long end,
        Double value,
        int count
) {
    public boolean hasValue() {
        return value != null;
    }
}
