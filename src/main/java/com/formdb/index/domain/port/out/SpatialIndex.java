package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;

import java.util.Collection;
import java.util.List;

/**
 * One bounding-box tree per database.
 * Operations on a database without a tree throw
 * {@link com.formdb.index.domain.exception.IndexNotFoundException}.
 */
public interface SpatialIndex {

    void createIndex(String database);

    /**
     * Build a tree from {@code features} and install it unless one already exists
     * @return true if the new tree was installed
     */
    boolean createIndexFrom(String database, Collection<Feature> features);

    boolean hasIndex(String database);

    void insert(String database, String featureId, BoundingBox bbox);

    /**
     * Ids of every indexed feature whose box intersects {@code bbox}, boundaries included
     */
    List<String> query(String database, BoundingBox bbox);

    void delete(String database, String featureId);

    /**
     * Idempotent
     */
    void dropIndex(String database);

    int size(String database);
}
