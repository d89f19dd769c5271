package com.formdb.index.infrastructure.persistence;

import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.port.out.Journal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local journal adapter for tests and single-node runs.
 * Production deployments bind {@link Journal} to the durable store instead.
 */
@Repository
public class InMemoryJournal implements Journal {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryJournal.class);

    private final Map<String, Map<String, Feature>> features = new HashMap<>();
    private final Map<String, Map<String, TimePoint>> points = new HashMap<>();

    @Override
    public synchronized void appendFeature(Feature feature) {
        Map<String, Feature> stored = features.computeIfAbsent(feature.database(), k -> new LinkedHashMap<>());
        if (stored.putIfAbsent(feature.id(), feature) != null) {
            throw new IllegalStateException("Feature " + feature.id() + " already journaled");
        }
        logger.debug("Journaled feature {} in database {}", feature.id(), feature.database());
    }

    @Override
    public synchronized void appendPoint(TimePoint point) {
        Map<String, TimePoint> stored = points.computeIfAbsent(point.database(), k -> new LinkedHashMap<>());
        if (stored.putIfAbsent(point.id(), point) != null) {
            throw new IllegalStateException("Point " + point.id() + " already journaled");
        }
        logger.debug("Journaled point {} of series {} in database {}",
                point.id(), point.seriesId(), point.database());
    }

    @Override
    public synchronized Optional<Feature> tombstoneFeature(String database, String featureId) {
        Map<String, Feature> stored = features.get(database);
        Feature feature = stored == null ? null : stored.remove(featureId);
        if (feature == null) {
            return Optional.empty();
        }
        logger.debug("Tombstoned feature {} in database {}", featureId, database);
        return Optional.of(feature);
    }

    @Override
    public synchronized Optional<TimePoint> tombstonePoint(String database, String seriesId, String pointId) {
        Map<String, TimePoint> stored = points.get(database);
        if (stored == null) {
            return Optional.empty();
        }
        TimePoint point = stored.get(pointId);
        if (point == null || !point.seriesId().equals(seriesId)) {
            return Optional.empty();
        }
        stored.remove(pointId);
        logger.debug("Tombstoned point {} of series {} in database {}", pointId, seriesId, database);
        return Optional.of(point);
    }

    @Override
    public synchronized List<Feature> fetchFeaturesByIds(String database, List<String> ids) {
        Map<String, Feature> stored = features.getOrDefault(database, Map.of());
        return ids.stream()
                .map(stored::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public synchronized List<TimePoint> fetchPointsByIds(String database, List<String> ids) {
        Map<String, TimePoint> stored = points.getOrDefault(database, Map.of());
        return ids.stream()
                .map(stored::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public synchronized List<Feature> fullScanBbox(String database, BoundingBox bbox) {
        return features.getOrDefault(database, Map.of()).values().stream()
                .filter(feature -> feature.bbox().intersects(bbox))
                .sorted(Comparator.comparing(Feature::id))
                .toList();
    }

    @Override
    public synchronized List<TimePoint> fullScanTimeSeries(String database, String seriesId, long start, long end) {
        return points.getOrDefault(database, Map.of()).values().stream()
                .filter(point -> point.seriesId().equals(seriesId))
                .filter(point -> point.timestamp() >= start && point.timestamp() <= end)
                .sorted(Comparator.comparingLong(TimePoint::timestamp).thenComparing(TimePoint::id))
                .toList();
    }
}
