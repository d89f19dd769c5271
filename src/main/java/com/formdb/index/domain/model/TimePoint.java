package com.formdb.index.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time-series sample as stored in the journal.
 * Timestamps are epoch milliseconds; (timestamp, id) orders points totally.
 */
public record TimePoint(
        String id,
        String database,
        String seriesId,
        long timestamp,
        double value,
        Map<String, Object> metadata,
        Map<String, Object> provenance
) {
    public TimePoint {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        provenance = provenance == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
    }

    public static TimePoint of(String database, String seriesId, String id, long timestamp, double value) {
        return new TimePoint(id, database, seriesId, timestamp, value, Map.of(), Map.of());
    }
}
