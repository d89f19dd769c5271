package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.TimePoint;

import java.util.List;
import java.util.Optional;

/**
 * Append-only record store and single source of truth for record content.
 * Indexes hold ids only and resolve them through this port.
 */
public interface Journal {

    void appendFeature(Feature feature);

    void appendPoint(TimePoint point);

    /**
     * Record the deletion of a feature; later fetches and scans no longer return it
     * @return the deleted feature, or empty if it was never journaled or is already deleted
     */
    Optional<Feature> tombstoneFeature(String database, String featureId);

    /**
     * Record the deletion of a point of {@code seriesId}
     * @return the deleted point, or empty if the series holds no such point
     */
    Optional<TimePoint> tombstonePoint(String database, String seriesId, String pointId);

    /**
     * Resolve feature ids, preserving the order of {@code ids}; unknown ids are skipped
     */
    List<Feature> fetchFeaturesByIds(String database, List<String> ids);

    /**
     * Resolve point ids, preserving the order of {@code ids}; unknown ids are skipped
     */
    List<TimePoint> fetchPointsByIds(String database, List<String> ids);

    /**
     * Unindexed scan of every feature intersecting {@code bbox}
     */
    List<Feature> fullScanBbox(String database, BoundingBox bbox);

    /**
     * Unindexed scan of a series for start <= timestamp <= end, ordered by (timestamp, id)
     */
    List<TimePoint> fullScanTimeSeries(String database, String seriesId, long start, long end);
}
