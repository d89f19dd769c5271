package com.formdb.index.application;

import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.ChangeEvent;
import com.formdb.index.domain.model.ChangeType;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.domain.model.TimePoint;
import com.formdb.index.domain.port.out.ChangeEventPublisher;
import com.formdb.index.domain.port.out.Journal;
import com.formdb.index.domain.port.out.QueryCache;
import com.formdb.index.domain.port.out.SpatialIndex;
import com.formdb.index.domain.port.out.TemporalIndex;
import com.formdb.index.infrastructure.config.IndexingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Runs after every journal write: update the owning index, invalidate the database's cached
 * results, then publish a change event. Invalidation always runs, whatever happened to the
 * index update, and a failed invalidation clears the whole cache.
 */
@Service
public class IndexCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(IndexCoordinator.class);

    private final SpatialIndex spatialIndex;
    private final TemporalIndex temporalIndex;
    private final QueryCache cache;
    private final ChangeEventPublisher publisher;
    private final Journal journal;
    private final IndexingProperties properties;
    private final Clock clock;

    public IndexCoordinator(SpatialIndex spatialIndex,
                            TemporalIndex temporalIndex,
                            QueryCache cache,
                            ChangeEventPublisher publisher,
                            Journal journal,
                            IndexingProperties properties,
                            Clock clock) {
        this.spatialIndex = spatialIndex;
        this.temporalIndex = temporalIndex;
        this.cache = cache;
        this.publisher = publisher;
        this.journal = journal;
        this.properties = properties;
        this.clock = clock;
    }

    public void onInsertFeature(Feature feature) {
        try {
            indexFeature(feature);
        } catch (Exception e) {
            logger.error("Failed to index feature {} of database {}", feature.id(), feature.database(), e);
        }
        invalidate(feature.database());
        publish(ChangeEvent.forFeature(feature, ChangeType.INSERT, clock.instant()));
    }

    public void onInsertPoint(TimePoint point) {
        try {
            indexPoint(point);
        } catch (Exception e) {
            logger.error("Failed to index point {} of series {}/{}",
                    point.id(), point.database(), point.seriesId(), e);
        }
        invalidate(point.database());
        publish(ChangeEvent.forPoint(point, ChangeType.INSERT, clock.instant()));
    }

    public void onDeleteFeature(Feature feature) {
        try {
            spatialIndex.delete(feature.database(), feature.id());
        } catch (EntryNotFoundException | IndexNotFoundException e) {
            logger.warn("Feature {} was not indexed in database {}: {}",
                    feature.id(), feature.database(), e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to unindex feature {} of database {}", feature.id(), feature.database(), e);
        }
        invalidate(feature.database());
        publish(ChangeEvent.forFeature(feature, ChangeType.DELETE, clock.instant()));
    }

    public void onDeletePoint(TimePoint point) {
        try {
            temporalIndex.delete(point.database(), point.seriesId(), point.id(), point.timestamp());
        } catch (EntryNotFoundException | IndexNotFoundException e) {
            logger.warn("Point {} was not indexed in series {}/{}: {}",
                    point.id(), point.database(), point.seriesId(), e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to unindex point {} of series {}/{}",
                    point.id(), point.database(), point.seriesId(), e);
        }
        invalidate(point.database());
        publish(ChangeEvent.forPoint(point, ChangeType.DELETE, clock.instant()));
    }

    // ===== Private Helper Methods =====

    private void indexFeature(Feature feature) {
        String database = feature.database();
        try {
            spatialIndex.insert(database, feature.id(), feature.bbox());
        } catch (IndexNotFoundException e) {
            if (!properties.isRebuildOnMissing()) {
                throw e;
            }
            // The journal scan already contains this feature
            List<Feature> journaled = journal.fullScanBbox(database, BoundingBox.EVERYTHING);
            if (spatialIndex.createIndexFrom(database, journaled)) {
                logger.info("Rebuilt spatial index of database {} from {} journaled features",
                        database, journaled.size());
            } else {
                spatialIndex.insert(database, feature.id(), feature.bbox());
            }
        }
    }

    private void indexPoint(TimePoint point) {
        String database = point.database();
        String seriesId = point.seriesId();
        try {
            temporalIndex.insert(database, seriesId, point.id(), point.timestamp());
        } catch (IndexNotFoundException e) {
            if (!properties.isRebuildOnMissing()) {
                throw e;
            }
            List<TimePoint> journaled = journal.fullScanTimeSeries(database, seriesId, Long.MIN_VALUE, Long.MAX_VALUE);
            if (temporalIndex.createIndexFrom(database, seriesId, journaled)) {
                logger.info("Built temporal index of series {}/{} from {} journaled points",
                        database, seriesId, journaled.size());
            } else {
                temporalIndex.insert(database, seriesId, point.id(), point.timestamp());
            }
        }
    }

    private void invalidate(String database) {
        try {
            cache.invalidateDatabase(database);
        } catch (Exception e) {
            logger.error("Cache invalidation failed for database {}, clearing entire cache", database, e);
            cache.invalidateAll();
        }
    }

    private void publish(ChangeEvent event) {
        try {
            int queued = publisher.publish(event);
            logger.debug("Change event for {} {} queued for {} subscribers",
                    event.kind(), event.recordId(), queued);
        } catch (Exception e) {
            logger.warn("Failed to publish change event for {} {}: {}",
                    event.kind(), event.recordId(), e.getMessage());
        }
    }
}
