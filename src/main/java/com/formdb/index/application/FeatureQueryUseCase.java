package com.formdb.index.application;

import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.QueryKey;
import com.formdb.index.domain.model.QueryResult;
import com.formdb.index.domain.model.ResultOrigin;
import com.formdb.index.domain.port.out.Journal;
import com.formdb.index.domain.port.out.QueryCache;
import com.formdb.index.domain.port.out.SpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class FeatureQueryUseCase implements FindFeatures {

    private static final Logger logger = LoggerFactory.getLogger(FeatureQueryUseCase.class);

    static final String QUERY_KIND = "bbox";

    private final SpatialIndex spatialIndex;
    private final Journal journal;
    private final QueryCache cache;

    public FeatureQueryUseCase(SpatialIndex spatialIndex, Journal journal, QueryCache cache) {
        this.spatialIndex = spatialIndex;
        this.journal = journal;
        this.cache = cache;
    }

    @Override
    public QueryResult<List<Feature>> execute(String database, BoundingBox bbox, int limit) {
        if (bbox == null) {
            throw new IllegalArgumentException("Query bounding box is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        logger.debug("Searching features of {} within {} (limit {})", database, bbox, limit);

        QueryKey key = QueryKey.of(database, QUERY_KIND, Map.of("bbox", bbox.toArray(), "limit", limit));
        // Read before the lookup so a write landing mid-query voids our put
        long generation = cache.generation(database);

        Optional<CachedFeatures> cached = cache.get(key, CachedFeatures.class);
        if (cached.isPresent()) {
            List<Feature> features = cached.get().features();
            logger.debug("Cache hit: {} features", features.size());
            return new QueryResult<>(features, ResultOrigin.CACHE);
        }

        ResultOrigin origin;
        List<Feature> matches;
        try {
            List<String> ids = spatialIndex.query(database, bbox);
            matches = journal.fetchFeaturesByIds(database, ids);
            origin = ResultOrigin.INDEX;
        } catch (IndexNotFoundException e) {
            logger.info("No spatial index for database {}, falling back to journal scan", database);
            matches = journal.fullScanBbox(database, bbox);
            origin = ResultOrigin.FALLBACK;
        }

        List<Feature> features = matches.stream()
                .sorted(Comparator.comparing(Feature::id))
                .limit(limit)
                .toList();

        if (!cache.put(key, new CachedFeatures(features), generation)) {
            logger.debug("Result for {} not cached, database changed during the query", key);
        }
        logger.debug("Found {} features via {}", features.size(), origin);
        return new QueryResult<>(features, origin);
    }

    record CachedFeatures(List<Feature> features) {
    }
}
