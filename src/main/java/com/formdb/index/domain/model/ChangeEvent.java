package com.formdb.index.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Notification published after a write has been indexed and the cache invalidated.
 * Feature events carry {@code bbox}; time-series events carry series id, timestamp and value.
 */
public record ChangeEvent(
        String database,
        RecordKind kind,
        ChangeType type,
        String recordId,
        BoundingBox bbox,
        String seriesId,
        Long timestamp,
        Double value,
        Map<String, Object> provenance,
        Map<String, Object> metadata,
        Instant occurredAt
) {
    public static ChangeEvent forFeature(Feature feature, ChangeType type, Instant occurredAt) {
        return new ChangeEvent(
                feature.database(),
                RecordKind.FEATURE,
                type,
                feature.id(),
                feature.bbox(),
                null,
                null,
                null,
                feature.provenance(),
                feature.properties(),
                occurredAt
        );
    }

    public static ChangeEvent forPoint(TimePoint point, ChangeType type, Instant occurredAt) {
        return new ChangeEvent(
                point.database(),
                RecordKind.TIME_SERIES,
                type,
                point.id(),
                null,
                point.seriesId(),
                point.timestamp(),
                point.value(),
                point.provenance(),
                point.metadata(),
                occurredAt
        );
    }
}
