package com.formdb.index.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.GeometryBounds;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.port.out.Journal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Write path: append the record (or its tombstone) to the journal, then hand it to the
 * {@link IndexCoordinator}. A journal failure propagates and nothing is indexed.
 */
@Service
public class IngestRecords {

    private static final Logger logger = LoggerFactory.getLogger(IngestRecords.class);

    private final Journal journal;
    private final IndexCoordinator coordinator;

    public IngestRecords(Journal journal, IndexCoordinator coordinator) {
        this.journal = journal;
        this.coordinator = coordinator;
    }

    public Feature insertFeature(String database, JsonNode geometry,
                                 Map<String, Object> properties, Map<String, Object> provenance) {
        BoundingBox bbox = GeometryBounds.of(geometry);
        Feature feature = new Feature(
                UUID.randomUUID().toString(), database, bbox, geometry, properties, provenance);

        journal.appendFeature(feature);
        coordinator.onInsertFeature(feature);

        logger.info("Inserted feature {} into database {} with bbox {}", feature.id(), database, bbox);
        return feature;
    }

    public TimePoint insertPoint(String database, String seriesId, long timestamp, double value,
                                 Map<String, Object> metadata, Map<String, Object> provenance) {
        if (seriesId == null || seriesId.isBlank()) {
            throw new IllegalArgumentException("Series id is required");
        }
        TimePoint point = new TimePoint(
                UUID.randomUUID().toString(), database, seriesId, timestamp, value, metadata, provenance);

        journal.appendPoint(point);
        coordinator.onInsertPoint(point);

        logger.debug("Inserted point {} into series {}/{} at {}", point.id(), database, seriesId, timestamp);
        return point;
    }

    /**
     * @throws EntryNotFoundException if the journal holds no such feature
     */
    public Feature deleteFeature(String database, String featureId) {
        Feature feature = journal.tombstoneFeature(database, featureId)
                .orElseThrow(() -> new EntryNotFoundException(
                        "Feature " + featureId + " not found in database " + database));
        coordinator.onDeleteFeature(feature);

        logger.info("Deleted feature {} from database {}", featureId, database);
        return feature;
    }

    /**
     * @throws EntryNotFoundException if the series holds no such point
     */
    public TimePoint deletePoint(String database, String seriesId, String pointId) {
        TimePoint point = journal.tombstonePoint(database, seriesId, pointId)
                .orElseThrow(() -> new EntryNotFoundException(
                        "Point " + pointId + " not found in series " + database + "/" + seriesId));
        coordinator.onDeletePoint(point);

        logger.debug("Deleted point {} from series {}/{}", pointId, database, seriesId);
        return point;
    }
}
