package com.formdb.index.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Optional constraints a subscriber places on the events of its database.
 * A null field does not constrain; the series filter only applies to time-series events
 * and the bbox filter only to feature events.
 */
public record SubscriptionFilter(
        RecordKind kind,
        String seriesId,
        BoundingBox bbox
) {
    private static final SubscriptionFilter NONE = new SubscriptionFilter(null, null, null);

    public static SubscriptionFilter none() {
        return NONE;
    }

    public static SubscriptionFilter ofKind(RecordKind kind) {
        return new SubscriptionFilter(kind, null, null);
    }

    public static SubscriptionFilter ofSeries(String seriesId) {
        return new SubscriptionFilter(null, seriesId, null);
    }

    public static SubscriptionFilter ofBbox(BoundingBox bbox) {
        return new SubscriptionFilter(null, null, bbox);
    }

    /**
     * Reads a channel join payload such as
     * {@code {"record_kind": "timeseries", "series_id": "sensor_001"}} or
     * {@code {"bbox": [-74.1, 40.6, -73.9, 40.8]}}. Missing or null payloads match everything.
     */
    public static SubscriptionFilter fromPayload(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isEmpty()) {
            return NONE;
        }

        RecordKind kind = null;
        JsonNode kindNode = payload.get("record_kind");
        if (kindNode != null && !kindNode.isNull()) {
            kind = RecordKind.fromWireName(kindNode.asText());
        }

        String seriesId = null;
        JsonNode seriesNode = payload.get("series_id");
        if (seriesNode != null && !seriesNode.isNull()) {
            seriesId = seriesNode.asText();
        }

        BoundingBox bbox = null;
        JsonNode bboxNode = payload.get("bbox");
        if (bboxNode != null && !bboxNode.isNull()) {
            if (!bboxNode.isArray() || bboxNode.size() != 4) {
                throw new IllegalArgumentException("bbox filter must be [minx, miny, maxx, maxy]");
            }
            bbox = new BoundingBox(
                    bboxNode.get(0).asDouble(),
                    bboxNode.get(1).asDouble(),
                    bboxNode.get(2).asDouble(),
                    bboxNode.get(3).asDouble());
        }

        return new SubscriptionFilter(kind, seriesId, bbox);
    }

    public boolean matches(ChangeEvent event) {
        if (kind != null && kind != event.kind()) {
            return false;
        }
        if (seriesId != null && event.kind() == RecordKind.TIME_SERIES
                && !seriesId.equals(event.seriesId())) {
            return false;
        }
        if (bbox != null && event.kind() == RecordKind.FEATURE
                && (event.bbox() == null || !bbox.intersects(event.bbox()))) {
            return false;
        }
        return true;
    }
}
