package com.formdb.index.application;

import com.formdb.index.domain.port.in.SubscriptionService;
import com.formdb.index.domain.port.out.QueryCache;
import com.formdb.index.domain.port.out.SpatialIndex;
import com.formdb.index.domain.port.out.TemporalIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hooks invoked by database management when a database entity is created or dropped.
 */
@Service
public class DatabaseLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseLifecycle.class);

    private final SpatialIndex spatialIndex;
    private final TemporalIndex temporalIndex;
    private final QueryCache cache;
    private final SubscriptionService subscriptions;

    public DatabaseLifecycle(SpatialIndex spatialIndex,
                             TemporalIndex temporalIndex,
                             QueryCache cache,
                             SubscriptionService subscriptions) {
        this.spatialIndex = spatialIndex;
        this.temporalIndex = temporalIndex;
        this.cache = cache;
        this.subscriptions = subscriptions;
    }

    /**
     * Creates the spatial index of a new database. Series indexes are created on first write.
     *
     * @throws com.formdb.index.domain.exception.IndexAlreadyExistsException if the database is already indexed
     */
    public void onDatabaseCreated(String database) {
        spatialIndex.createIndex(database);
        logger.info("Indexes prepared for database {}", database);
    }

    public void onDatabaseDropped(String database) {
        spatialIndex.dropIndex(database);
        temporalIndex.dropDatabase(database);
        cache.invalidateDatabase(database);
        int closed = subscriptions.unsubscribeAll(database);
        logger.info("Released indexes, cached results and {} subscriptions of database {}", closed, database);
    }
}
