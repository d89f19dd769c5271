package com.formdb.index.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.exception.InvalidBoundingBoxException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.port.out.Journal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestRecordsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private Journal journal;

    @Mock
    private IndexCoordinator coordinator;

    private IngestRecords ingestRecords;

    @BeforeEach
    void setUp() {
        ingestRecords = new IngestRecords(journal, coordinator);
    }

    @Test
    void shouldJournalFeatureBeforeCoordinating() throws Exception {
        // Given
        JsonNode geometry = objectMapper.readTree("""
                {"type": "LineString", "coordinates": [[-74.0, 40.7], [-73.9, 40.8]]}
                """);

        // When
        Feature feature = ingestRecords.insertFeature("geo", geometry, Map.of("name", "Broadway"), null);

        // Then
        assertThat(feature.id()).isNotBlank();
        assertThat(feature.bbox()).isEqualTo(BoundingBox.of(-74.0, 40.7, -73.9, 40.8));
        assertThat(feature.properties()).containsEntry("name", "Broadway");
        InOrder inOrder = inOrder(journal, coordinator);
        inOrder.verify(journal).appendFeature(feature);
        inOrder.verify(coordinator).onInsertFeature(feature);
    }

    @Test
    void shouldNotCoordinateWhenJournalRejectsWrite() {
        // Given
        doThrow(new IllegalStateException("journal unavailable")).when(journal).appendPoint(any());

        // When / Then
        assertThatThrownBy(() -> ingestRecords.insertPoint("sensors", "sensor_001", 60_000L, 21.0, null, null))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldAssignDistinctIdsToPoints() {
        TimePoint first = ingestRecords.insertPoint("sensors", "sensor_001", 60_000L, 21.0, null, null);
        TimePoint second = ingestRecords.insertPoint("sensors", "sensor_001", 60_000L, 21.0, null, null);

        assertThat(first.id()).isNotEqualTo(second.id());
        verify(coordinator).onInsertPoint(first);
        verify(coordinator).onInsertPoint(second);
    }

    @Test
    void shouldRejectGeometryWithoutCoordinates() throws Exception {
        JsonNode geometry = objectMapper.readTree("""
                {"type": "Point"}
                """);

        assertThatThrownBy(() -> ingestRecords.insertFeature("geo", geometry, null, null))
                .isInstanceOf(InvalidBoundingBoxException.class);
        verifyNoInteractions(journal, coordinator);
    }

    @Test
    void shouldTombstoneFeatureBeforeCoordinatingDelete() {
        // Given
        Feature feature = Feature.of("geo", "f-1", BoundingBox.point(-74.0, 40.7));
        when(journal.tombstoneFeature("geo", "f-1")).thenReturn(Optional.of(feature));

        // When
        Feature deleted = ingestRecords.deleteFeature("geo", "f-1");

        // Then
        assertThat(deleted).isEqualTo(feature);
        InOrder inOrder = inOrder(journal, coordinator);
        inOrder.verify(journal).tombstoneFeature("geo", "f-1");
        inOrder.verify(coordinator).onDeleteFeature(feature);
    }

    @Test
    void shouldRejectDeleteOfUnknownFeature() {
        // Given
        when(journal.tombstoneFeature("geo", "missing")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> ingestRecords.deleteFeature("geo", "missing"))
                .isInstanceOf(EntryNotFoundException.class)
                .hasMessageContaining("missing");
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldTombstonePointBeforeCoordinatingDelete() {
        // Given
        TimePoint point = TimePoint.of("sensors", "sensor_001", "p-1", 60_000L, 21.0);
        when(journal.tombstonePoint("sensors", "sensor_001", "p-1")).thenReturn(Optional.of(point));

        // When
        TimePoint deleted = ingestRecords.deletePoint("sensors", "sensor_001", "p-1");

        // Then
        assertThat(deleted).isEqualTo(point);
        InOrder inOrder = inOrder(journal, coordinator);
        inOrder.verify(journal).tombstonePoint("sensors", "sensor_001", "p-1");
        inOrder.verify(coordinator).onDeletePoint(point);
    }

    @Test
    void shouldRejectDeleteOfPointFromOtherSeries() {
        when(journal.tombstonePoint("sensors", "sensor_002", "p-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ingestRecords.deletePoint("sensors", "sensor_002", "p-1"))
                .isInstanceOf(EntryNotFoundException.class);
        verifyNoInteractions(coordinator);
    }
}
