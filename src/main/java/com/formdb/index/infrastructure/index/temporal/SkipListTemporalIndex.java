package com.formdb.index.infrastructure.index.temporal;

import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.exception.IndexAlreadyExistsException;
import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.exception.InvalidRangeException;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.port.out.TemporalIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Temporal index registry keyed by (database, series).
 */
@Component
public class SkipListTemporalIndex implements TemporalIndex {

    private static final Logger logger = LoggerFactory.getLogger(SkipListTemporalIndex.class);

    private final ConcurrentMap<SeriesKey, SeriesIndex> series = new ConcurrentHashMap<>();

    @Override
    public void createIndex(String database, String seriesId) {
        SeriesKey key = new SeriesKey(database, seriesId);
        if (series.putIfAbsent(key, new SeriesIndex()) != null) {
            throw new IndexAlreadyExistsException("Temporal index already exists for " + key);
        }
        logger.info("Created temporal index for {}", key);
    }

    @Override
    public boolean createIndexFrom(String database, String seriesId, Collection<TimePoint> points) {
        SeriesKey key = new SeriesKey(database, seriesId);
        SeriesIndex index = new SeriesIndex();
        for (TimePoint point : points) {
            index.insert(point.id(), point.timestamp());
        }

        boolean installed = series.putIfAbsent(key, index) == null;
        if (installed) {
            logger.info("Built temporal index for {} with {} points", key, index.size());
        } else {
            logger.debug("Temporal index for {} appeared concurrently, discarding rebuild", key);
        }
        return installed;
    }

    @Override
    public boolean hasIndex(String database, String seriesId) {
        return series.containsKey(new SeriesKey(database, seriesId));
    }

    @Override
    public void insert(String database, String seriesId, String pointId, long timestamp) {
        requireSeries(database, seriesId).insert(pointId, timestamp);
    }

    @Override
    public List<String> rangeQuery(String database, String seriesId, long start, long end, int limit) {
        if (start > end) {
            throw new InvalidRangeException("Range start " + start + " is after end " + end);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<String> ids = requireSeries(database, seriesId).range(start, end, limit);
        logger.debug("Range [{}, {}] on {}/{} returned {} points", start, end, database, seriesId, ids.size());
        return ids;
    }

    @Override
    public void delete(String database, String seriesId, String pointId, long timestamp) {
        if (!requireSeries(database, seriesId).remove(pointId, timestamp)) {
            throw new EntryNotFoundException(
                    "Point " + pointId + "@" + timestamp + " is not indexed in " + database + "/" + seriesId);
        }
    }

    @Override
    public void dropIndex(String database, String seriesId) {
        if (series.remove(new SeriesKey(database, seriesId)) != null) {
            logger.info("Dropped temporal index for {}/{}", database, seriesId);
        }
    }

    @Override
    public void dropDatabase(String database) {
        int before = series.size();
        series.keySet().removeIf(key -> key.database().equals(database));
        logger.info("Dropped {} temporal indexes for database {}", before - series.size(), database);
    }

    @Override
    public int size(String database, String seriesId) {
        return requireSeries(database, seriesId).size();
    }

    private SeriesIndex requireSeries(String database, String seriesId) {
        SeriesIndex index = series.get(new SeriesKey(database, seriesId));
        if (index == null) {
            throw new IndexNotFoundException("No temporal index for " + database + "/" + seriesId);
        }
        return index;
    }
}
