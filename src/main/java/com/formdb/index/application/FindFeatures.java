package com.formdb.index.application;

import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.QueryResult;

import java.util.List;

/**
 * Bounding-box search over the features of one database.
 */
public interface FindFeatures {

    /**
     * Finds the features whose bounding box intersects {@code bbox}, edges included.
     *
     * @param database The database to search.
     * @param bbox The query rectangle.
     * @param limit Maximum number of features returned, must be positive.
     * @return Matching features ordered by id, tagged with where the answer came from.
     */
    QueryResult<List<Feature>> execute(String database, BoundingBox bbox, int limit);

}
