package com.formdb.index.application;

import com.formdb.index.domain.model.Aggregation;
import com.formdb.index.domain.model.QueryResult;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.model.TimeSeriesAggregate;

import java.util.List;

/**
 * Time-range reads over one series of a database.
 */
public interface FindTimeSeries {

    /**
     * Finds the points of {@code seriesId} with start <= timestamp <= end.
     *
     * @param database The database to search.
     * @param seriesId The series to read.
     * @param start Start of the range in epoch milliseconds (inclusive).
     * @param end End of the range in epoch milliseconds (inclusive).
     * @param limit Maximum number of points returned, must be positive.
     * @return Points in ascending (timestamp, id) order, tagged with where the answer came from.
     */
    QueryResult<List<TimePoint>> execute(String database, String seriesId, long start, long end, int limit);

    /**
     * Reduces every point of the range to a single value.
     */
    QueryResult<TimeSeriesAggregate> aggregate(String database, String seriesId, long start, long end,
                                               Aggregation aggregation);

}
