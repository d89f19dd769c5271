package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.exception.IndexAlreadyExistsException;
import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.port.out.SpatialIndex;
import com.formdb.index.infrastructure.config.IndexingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Spatial index registry: one {@link RTree} per database, each serializing its own mutations.
 */
@Component
public class RTreeSpatialIndex implements SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(RTreeSpatialIndex.class);

    private final ConcurrentMap<String, RTree> trees = new ConcurrentHashMap<>();
    private final IndexingProperties properties;

    public RTreeSpatialIndex(IndexingProperties properties) {
        this.properties = properties;
    }

    @Override
    public void createIndex(String database) {
        if (trees.putIfAbsent(database, newTree()) != null) {
            throw new IndexAlreadyExistsException("Spatial index already exists for database " + database);
        }
        logger.info("Created spatial index for database {}", database);
    }

    @Override
    public boolean createIndexFrom(String database, Collection<Feature> features) {
        RTree tree = newTree();
        for (Feature feature : features) {
            tree.insert(feature.id(), feature.bbox());
        }

        boolean installed = trees.putIfAbsent(database, tree) == null;
        if (installed) {
            logger.info("Built spatial index for database {} with {} features", database, tree.size());
        } else {
            logger.debug("Spatial index for database {} appeared concurrently, discarding rebuild", database);
        }
        return installed;
    }

    @Override
    public boolean hasIndex(String database) {
        return trees.containsKey(database);
    }

    @Override
    public void insert(String database, String featureId, BoundingBox bbox) {
        requireTree(database).insert(featureId, bbox);
        logger.debug("Indexed feature {} in database {}", featureId, database);
    }

    @Override
    public List<String> query(String database, BoundingBox bbox) {
        List<String> ids = requireTree(database).search(bbox);
        logger.debug("Spatial query {} on database {} matched {} features", bbox, database, ids.size());
        return ids;
    }

    @Override
    public void delete(String database, String featureId) {
        if (!requireTree(database).remove(featureId)) {
            throw new EntryNotFoundException(
                    "Feature " + featureId + " is not in the spatial index of database " + database);
        }
        logger.debug("Removed feature {} from database {}", featureId, database);
    }

    @Override
    public void dropIndex(String database) {
        if (trees.remove(database) != null) {
            logger.info("Dropped spatial index for database {}", database);
        }
    }

    @Override
    public int size(String database) {
        return requireTree(database).size();
    }

    RTree tree(String database) {
        return requireTree(database);
    }

    private RTree requireTree(String database) {
        RTree tree = trees.get(database);
        if (tree == null) {
            throw new IndexNotFoundException("No spatial index for database " + database);
        }
        return tree;
    }

    private RTree newTree() {
        return new RTree(properties.getSpatialMaxEntries(), properties.getSpatialMinEntries());
    }
}
