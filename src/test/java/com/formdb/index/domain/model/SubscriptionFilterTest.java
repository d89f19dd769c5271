package com.formdb.index.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldParseJoinPayload() throws Exception {
        // When
        SubscriptionFilter filter = SubscriptionFilter.fromPayload(objectMapper.readTree("""
                {"record_kind": "timeseries", "series_id": "sensor_001", "bbox": [-75, 40, -73, 41]}
                """));

        // Then
        assertThat(filter.kind()).isEqualTo(RecordKind.TIME_SERIES);
        assertThat(filter.seriesId()).isEqualTo("sensor_001");
        assertThat(filter.bbox()).isEqualTo(BoundingBox.of(-75, 40, -73, 41));
    }

    @Test
    void shouldMatchEverythingForEmptyPayload() throws Exception {
        assertThat(SubscriptionFilter.fromPayload(objectMapper.readTree("{}"))).isEqualTo(SubscriptionFilter.none());
        assertThat(SubscriptionFilter.fromPayload(null)).isEqualTo(SubscriptionFilter.none());
    }

    @Test
    void shouldRejectMalformedBbox() throws Exception {
        assertThatThrownBy(() -> SubscriptionFilter.fromPayload(objectMapper.readTree("""
                {"bbox": [1, 2, 3]}
                """))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldIgnoreSeriesFilterForFeatureEvents() {
        SubscriptionFilter filter = SubscriptionFilter.ofSeries("sensor_001");
        ChangeEvent feature = ChangeEvent.forFeature(
                Feature.of("geo", "f-1", BoundingBox.point(0, 0)), ChangeType.INSERT, Instant.EPOCH);
        ChangeEvent otherSeries = ChangeEvent.forPoint(
                TimePoint.of("geo", "sensor_002", "p-1", 0, 1), ChangeType.INSERT, Instant.EPOCH);

        assertThat(filter.matches(feature)).isTrue();
        assertThat(filter.matches(otherSeries)).isFalse();
    }

    @Test
    void shouldMatchBboxInclusively() {
        SubscriptionFilter filter = SubscriptionFilter.ofBbox(BoundingBox.of(0, 0, 10, 10));
        ChangeEvent onEdge = ChangeEvent.forFeature(
                Feature.of("geo", "f-1", BoundingBox.of(10, 10, 20, 20)), ChangeType.INSERT, Instant.EPOCH);
        ChangeEvent outside = ChangeEvent.forFeature(
                Feature.of("geo", "f-2", BoundingBox.of(11, 11, 20, 20)), ChangeType.INSERT, Instant.EPOCH);

        assertThat(filter.matches(onEdge)).isTrue();
        assertThat(filter.matches(outside)).isFalse();
    }
}
