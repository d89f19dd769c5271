package com.formdb.index.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.formdb.index.domain.exception.InvalidBoundingBoxException;

/**
 * Derives the bounding box of a GeoJSON geometry.
 */
public final class GeometryBounds {

    private GeometryBounds() {
    }

    public static BoundingBox of(JsonNode geometry) {
        if (geometry == null || geometry.isNull()) {
            throw new InvalidBoundingBoxException("Feature has no geometry");
        }

        String type = geometry.path("type").asText("");
        if ("GeometryCollection".equals(type)) {
            BoundingBox bounds = null;
            for (JsonNode member : geometry.path("geometries")) {
                BoundingBox memberBounds = of(member);
                bounds = bounds == null ? memberBounds : bounds.union(memberBounds);
            }
            if (bounds == null) {
                throw new InvalidBoundingBoxException("Empty GeometryCollection");
            }
            return bounds;
        }

        double[] extent = {Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
        accumulate(geometry.path("coordinates"), extent);

        if (extent[0] == Double.POSITIVE_INFINITY) {
            throw new InvalidBoundingBoxException("Geometry of type '" + type + "' has no coordinates");
        }
        return new BoundingBox(extent[0], extent[1], extent[2], extent[3]);
    }

    // Positions are arrays whose first element is a number; anything else nests further.
    private static void accumulate(JsonNode node, double[] extent) {
        if (!node.isArray() || node.isEmpty()) {
            return;
        }
        if (node.get(0).isNumber()) {
            if (node.size() < 2) {
                throw new InvalidBoundingBoxException("Position needs at least two coordinates: " + node);
            }
            double x = node.get(0).asDouble();
            double y = node.get(1).asDouble();
            extent[0] = Math.min(extent[0], x);
            extent[1] = Math.min(extent[1], y);
            extent[2] = Math.max(extent[2], x);
            extent[3] = Math.max(extent[3], y);
            return;
        }
        for (JsonNode child : node) {
            accumulate(child, extent);
        }
    }
}
