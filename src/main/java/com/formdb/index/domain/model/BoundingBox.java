package com.formdb.index.domain.model;

import com.formdb.index.domain.exception.InvalidBoundingBoxException;

/**
 * Axis-aligned rectangle approximating the extent of a geometry.
 * Construction fails for inverted or non-finite coordinates.
 */
public record BoundingBox(
        double minX,
        double minY,
        double maxX,
        double maxY
) {
    /**
     * Largest finite box, used for full scans when rebuilding an index
     */
    public static final BoundingBox EVERYTHING =
            new BoundingBox(-Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE);

    public BoundingBox {
        if (!Double.isFinite(minX) || !Double.isFinite(minY)
                || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
            throw new InvalidBoundingBoxException(
                    String.format("Non-finite coordinate in bbox [%s, %s, %s, %s]", minX, minY, maxX, maxY));
        }
        if (minX > maxX || minY > maxY) {
            throw new InvalidBoundingBoxException(
                    String.format("Inverted bbox [%s, %s, %s, %s]", minX, minY, maxX, maxY));
        }
    }

    public static BoundingBox of(double minX, double minY, double maxX, double maxY) {
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    public static BoundingBox point(double x, double y) {
        return new BoundingBox(x, y, x, y);
    }

    /**
     * Inclusive intersection: boxes sharing only an edge or a corner intersect.
     */
    public boolean intersects(BoundingBox other) {
        return minX <= other.maxX && other.minX <= maxX
                && minY <= other.maxY && other.minY <= maxY;
    }

    public boolean contains(BoundingBox other) {
        return minX <= other.minX && other.maxX <= maxX
                && minY <= other.minY && other.maxY <= maxY;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(minX, other.minX),
                Math.min(minY, other.minY),
                Math.max(maxX, other.maxX),
                Math.max(maxY, other.maxY));
    }

    public double area() {
        return (maxX - minX) * (maxY - minY);
    }

    /**
     * Area that must be added to this box so it also covers {@code other}.
     */
    public double enlargement(BoundingBox other) {
        return union(other).area() - area();
    }

    public double[] toArray() {
        return new double[] {minX, minY, maxX, maxY};
    }
}
