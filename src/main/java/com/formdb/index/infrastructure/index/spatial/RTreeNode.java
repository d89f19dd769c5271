package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.model.BoundingBox;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of an {@link RTree}. Leaves hold {@link SpatialEntry entries}, internal nodes hold child nodes.
 * Only an empty root has a null box.
 */
final class RTreeNode implements Bounded {

    private final boolean leaf;
    private final List<SpatialEntry> entries;
    private final List<RTreeNode> children;
    private RTreeNode parent;
    private BoundingBox box;

    private RTreeNode(boolean leaf) {
        this.leaf = leaf;
        this.entries = leaf ? new ArrayList<>() : List.of();
        this.children = leaf ? List.of() : new ArrayList<>();
    }

    static RTreeNode newLeaf() {
        return new RTreeNode(true);
    }

    static RTreeNode newInternal() {
        return new RTreeNode(false);
    }

    boolean isLeaf() {
        return leaf;
    }

    List<SpatialEntry> entries() {
        return entries;
    }

    List<RTreeNode> children() {
        return children;
    }

    RTreeNode parent() {
        return parent;
    }

    @Override
    public BoundingBox box() {
        return box;
    }

    List<? extends Bounded> items() {
        if (leaf) {
            return entries;
        }
        return children;
    }

    int size() {
        return leaf ? entries.size() : children.size();
    }

    boolean isEmpty() {
        return size() == 0;
    }

    void addChild(RTreeNode child) {
        child.parent = this;
        children.add(child);
    }

    void removeChild(RTreeNode child) {
        children.remove(child);
        child.parent = null;
    }

    /**
     * Shrinks or grows the box to exactly cover the current entries or children.
     */
    void recomputeBox() {
        BoundingBox covering = null;
        for (Bounded item : items()) {
            covering = covering == null ? item.box() : covering.union(item.box());
        }
        box = covering;
    }
}
