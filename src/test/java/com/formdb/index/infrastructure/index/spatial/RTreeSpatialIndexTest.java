package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.exception.EntryNotFoundException;
import com.formdb.index.domain.exception.IndexAlreadyExistsException;
import com.formdb.index.domain.exception.IndexNotFoundException;
import com.formdb.index.domain.model.BoundingBox;
import com.formdb.index.domain.model.Feature;
import com.formdb.index.infrastructure.config.IndexingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RTreeSpatialIndexTest {

    private static final String DB = "geo";

    private RTreeSpatialIndex index;

    @BeforeEach
    void setUp() {
        index = new RTreeSpatialIndex(new IndexingProperties());
    }

    @Test
    void shouldQueryInsertedFeatures() {
        // Given
        index.createIndex(DB);
        index.insert(DB, "nyc", BoundingBox.point(-74.0060, 40.7128));
        index.insert(DB, "sf", BoundingBox.point(-122.4194, 37.7749));
        index.insert(DB, "park", BoundingBox.of(-74.0, 40.7, -73.9, 40.8));

        // When
        List<String> ids = index.query(DB, BoundingBox.of(-75, 40, -73, 41));

        // Then
        assertThat(ids).containsExactlyInAnyOrder("nyc", "park");
        assertThat(index.size(DB)).isEqualTo(3);
    }

    @Test
    void shouldRejectDuplicateIndexCreation() {
        index.createIndex(DB);

        assertThatThrownBy(() -> index.createIndex(DB))
                .isInstanceOf(IndexAlreadyExistsException.class);
    }

    @Test
    void shouldSignalMissingIndex() {
        assertThat(index.hasIndex(DB)).isFalse();
        assertThatThrownBy(() -> index.insert(DB, "f", BoundingBox.point(0, 0)))
                .isInstanceOf(IndexNotFoundException.class);
        assertThatThrownBy(() -> index.query(DB, BoundingBox.EVERYTHING))
                .isInstanceOf(IndexNotFoundException.class);
    }

    @Test
    void shouldKeepDatabasesIsolated() {
        // Given
        index.createIndex("a");
        index.createIndex("b");

        // When
        index.insert("a", "f-1", BoundingBox.of(0, 0, 1, 1));

        // Then
        assertThat(index.query("a", BoundingBox.EVERYTHING)).containsExactly("f-1");
        assertThat(index.query("b", BoundingBox.EVERYTHING)).isEmpty();
    }

    @Test
    void shouldFailDeletingUnknownFeature() {
        // Given
        index.createIndex(DB);
        index.insert(DB, "f-1", BoundingBox.of(0, 0, 1, 1));

        // When
        index.delete(DB, "f-1");

        // Then
        assertThat(index.query(DB, BoundingBox.EVERYTHING)).isEmpty();
        assertThatThrownBy(() -> index.delete(DB, "f-1"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void shouldInstallRebuiltIndexOnlyOnce() {
        // Given
        List<Feature> journaled = List.of(
                Feature.of(DB, "f-1", BoundingBox.of(0, 0, 1, 1)),
                Feature.of(DB, "f-2", BoundingBox.of(5, 5, 6, 6)));

        // When
        boolean first = index.createIndexFrom(DB, journaled);
        boolean second = index.createIndexFrom(DB, List.of(Feature.of(DB, "other", BoundingBox.point(9, 9))));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(index.query(DB, BoundingBox.EVERYTHING)).containsExactlyInAnyOrder("f-1", "f-2");
    }

    @Test
    void shouldDropIndexIdempotently() {
        index.createIndex(DB);

        index.dropIndex(DB);
        index.dropIndex(DB);

        assertThat(index.hasIndex(DB)).isFalse();
    }

    @Test
    void shouldStayConsistentUnderConcurrentWritersAndReaders() throws Exception {
        // Given
        index.createIndex(DB);
        int writers = 4;
        int perWriter = 250;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int w = 0; w < writers; w++) {
            int writer = w;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    double x = writer * 100 + i * 0.1;
                    index.insert(DB, writer + "-" + i, BoundingBox.of(x, x, x + 0.05, x + 0.05));
                }
                return null;
            }));
        }
        for (int r = 0; r < 2; r++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    assertThat(index.query(DB, BoundingBox.EVERYTHING).size())
                            .isLessThanOrEqualTo(writers * perWriter);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(index.size(DB)).isEqualTo(writers * perWriter);
        assertThat(index.query(DB, BoundingBox.EVERYTHING)).hasSize(writers * perWriter).doesNotHaveDuplicates();
        assertThat(index.tree(DB).height()).isGreaterThan(1);
    }
}
