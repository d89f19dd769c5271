package com.formdb.index.application;

import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.exception.InvalidRangeException;
import com.formdb.index.domain.model.Aggregation;
import com.formdb.index.domain.model.QueryKey;
import com.formdb.index.domain.model.QueryResult;
import com.formdb.index.domain.model.ResultOrigin;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.model.TimeSeriesAggregate;
import com.formdb.index.domain.port.out.Journal;
import com.formdb.index.domain.port.out.QueryCache;
import com.formdb.index.domain.port.out.TemporalIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

@Service
public class TimeSeriesQueryUseCase implements FindTimeSeries {

    private static final Logger logger = LoggerFactory.getLogger(TimeSeriesQueryUseCase.class);

    static final String RANGE_KIND = "timeseries";
    static final String AGGREGATE_KIND = "timeseries_aggregate";

    private final TemporalIndex temporalIndex;
    private final Journal journal;
    private final QueryCache cache;

    public TimeSeriesQueryUseCase(TemporalIndex temporalIndex, Journal journal, QueryCache cache) {
        this.temporalIndex = temporalIndex;
        this.journal = journal;
        this.cache = cache;
    }

    @Override
    public QueryResult<List<TimePoint>> execute(String database, String seriesId, long start, long end, int limit) {
        validateRange(start, end);
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        logger.debug("Reading series {}/{} from {} to {} (limit {})", database, seriesId, start, end, limit);

        QueryKey key = QueryKey.of(database, RANGE_KIND,
                Map.of("series_id", seriesId, "start", start, "end", end, "limit", limit));
        long generation = cache.generation(database);

        Optional<CachedPoints> cached = cache.get(key, CachedPoints.class);
        if (cached.isPresent()) {
            List<TimePoint> points = cached.get().points();
            logger.debug("Cache hit: {} points", points.size());
            return new QueryResult<>(points, ResultOrigin.CACHE);
        }

        QueryResult<List<TimePoint>> result = readRange(database, seriesId, start, end, limit);
        if (!cache.put(key, new CachedPoints(result.value()), generation)) {
            logger.debug("Result for {} not cached, database changed during the query", key);
        }
        logger.debug("Found {} points via {}", result.value().size(), result.origin());
        return result;
    }

    @Override
    public QueryResult<TimeSeriesAggregate> aggregate(String database, String seriesId, long start, long end,
                                                      Aggregation aggregation) {
        validateRange(start, end);
        Aggregation reduction = aggregation == null ? Aggregation.NONE : aggregation;

        QueryKey key = QueryKey.of(database, AGGREGATE_KIND,
                Map.of("series_id", seriesId, "start", start, "end", end, "aggregation", reduction));
        long generation = cache.generation(database);

        Optional<TimeSeriesAggregate> cached = cache.get(key, TimeSeriesAggregate.class);
        if (cached.isPresent()) {
            return new QueryResult<>(cached.get(), ResultOrigin.CACHE);
        }

        QueryResult<List<TimePoint>> range = readRange(database, seriesId, start, end, Integer.MAX_VALUE);
        List<TimePoint> points = range.value();
        OptionalDouble reduced = reduction.apply(points);
        TimeSeriesAggregate summary = new TimeSeriesAggregate(
                seriesId,
                reduction,
                start,
                end,
                reduced.isPresent() ? reduced.getAsDouble() : null,
                points.size()
        );

        cache.put(key, summary, generation);
        logger.debug("Aggregated {} points of {}/{} with {}", points.size(), database, seriesId, reduction);
        return new QueryResult<>(summary, range.origin());
    }

    private QueryResult<List<TimePoint>> readRange(String database, String seriesId, long start, long end, int limit) {
        try {
            List<String> ids = temporalIndex.rangeQuery(database, seriesId, start, end, limit);
            return new QueryResult<>(journal.fetchPointsByIds(database, ids), ResultOrigin.INDEX);
        } catch (IndexNotFoundException e) {
            logger.info("No temporal index for {}/{}, falling back to journal scan", database, seriesId);
            List<TimePoint> points = journal.fullScanTimeSeries(database, seriesId, start, end).stream()
                    .limit(limit)
                    .toList();
            return new QueryResult<>(points, ResultOrigin.FALLBACK);
        }
    }

    private static void validateRange(long start, long end) {
        if (start > end) {
            throw new InvalidRangeException("Range start " + start + " is after end " + end);
        }
    }

    record CachedPoints(List<TimePoint> points) {
    }
}
