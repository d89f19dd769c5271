package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.TimePoint;

import java.util.Collection;
import java.util.List;

/**
 * One ordered structure per (database, series), sorted by (timestamp, point id).
 */
public interface TemporalIndex {

    void createIndex(String database, String seriesId);

    /**
     * Build an index from {@code points} and install it unless one already exists
     * @return true if the new index was installed
     */
    boolean createIndexFrom(String database, String seriesId, Collection<TimePoint> points);

    boolean hasIndex(String database, String seriesId);

    void insert(String database, String seriesId, String pointId, long timestamp);

    /**
     * Point ids with start <= timestamp <= end in ascending (timestamp, id) order, at most {@code limit}
     */
    List<String> rangeQuery(String database, String seriesId, long start, long end, int limit);

    void delete(String database, String seriesId, String pointId, long timestamp);

    void dropIndex(String database, String seriesId);

    /**
     * Drop every series index of {@code database}
     */
    void dropDatabase(String database);

    int size(String database, String seriesId);
}
