package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.model.BoundingBox;

/**
 * Leaf entry: a feature reference and its stored box
 */
record SpatialEntry(String featureId, BoundingBox box) implements Bounded {
}
