package com.formdb.index.infrastructure.index.spatial;

import com.formdb.index.domain.model.BoundingBox;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounding-box tree (Guttman R-tree, quadratic split) over the features of one database.
 *
 * <p>Mutations take the write lock, so at most one is in flight; searches share the read lock
 * and see the tree as of the last completed mutation. Deletion drops emptied nodes but never
 * merges underfull ones, so every leaf stays at the same depth.
 */
final class RTree {

    private final int maxEntries;
    private final int minEntries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // id -> leaf currently holding the entry
    private final Map<String, RTreeNode> leafByFeature = new HashMap<>();

    private RTreeNode root = RTreeNode.newLeaf();
    private int height = 1;

    RTree(int maxEntries, int minEntries) {
        if (maxEntries < 2) {
            throw new IllegalArgumentException("maxEntries must be at least 2, got " + maxEntries);
        }
        if (minEntries < 1 || minEntries > maxEntries / 2) {
            throw new IllegalArgumentException(
                    "minEntries must be between 1 and " + maxEntries / 2 + ", got " + minEntries);
        }
        this.maxEntries = maxEntries;
        this.minEntries = minEntries;
    }

    /**
     * Adds or replaces the entry for {@code featureId}.
     */
    void insert(String featureId, BoundingBox bbox) {
        lock.writeLock().lock();
        try {
            if (leafByFeature.containsKey(featureId)) {
                removeEntry(featureId);
            }
            RTreeNode leaf = chooseLeaf(bbox);
            leaf.entries().add(new SpatialEntry(featureId, bbox));
            leafByFeature.put(featureId, leaf);
            adjustTree(leaf);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return false if no entry exists for {@code featureId}
     */
    boolean remove(String featureId) {
        lock.writeLock().lock();
        try {
            if (!leafByFeature.containsKey(featureId)) {
                return false;
            }
            removeEntry(featureId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<String> search(BoundingBox query) {
        lock.readLock().lock();
        try {
            List<String> matches = new ArrayList<>();
            collect(root, query, matches);
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return leafByFeature.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    int height() {
        lock.readLock().lock();
        try {
            return height;
        } finally {
            lock.readLock().unlock();
        }
    }

    RTreeNode root() {
        return root;
    }

    // ===== Search =====

    private void collect(RTreeNode node, BoundingBox query, List<String> matches) {
        if (node.box() == null || !node.box().intersects(query)) {
            return;
        }
        if (node.isLeaf()) {
            for (SpatialEntry entry : node.entries()) {
                if (entry.box().intersects(query)) {
                    matches.add(entry.featureId());
                }
            }
            return;
        }
        for (RTreeNode child : node.children()) {
            collect(child, query, matches);
        }
    }

    // ===== Insertion =====

    /**
     * Descends to the child needing the least area enlargement; ties go to the smaller
     * resulting area, then to the earliest child.
     */
    private RTreeNode chooseLeaf(BoundingBox bbox) {
        RTreeNode node = root;
        while (!node.isLeaf()) {
            RTreeNode best = null;
            double bestEnlargement = Double.POSITIVE_INFINITY;
            double bestArea = Double.POSITIVE_INFINITY;

            for (RTreeNode child : node.children()) {
                BoundingBox grown = child.box().union(bbox);
                double enlargement = grown.area() - child.box().area();
                double area = grown.area();
                if (best == null
                        || enlargement < bestEnlargement
                        || (enlargement == bestEnlargement && area < bestArea)) {
                    best = child;
                    bestEnlargement = enlargement;
                    bestArea = area;
                }
            }
            node = best;
        }
        return node;
    }

    /**
     * Walks from {@code node} to the root, splitting overflowing nodes and refreshing boxes.
     * Only a root split adds a level.
     */
    private void adjustTree(RTreeNode node) {
        RTreeNode current = node;
        while (true) {
            RTreeNode sibling = current.size() > maxEntries ? split(current) : null;
            current.recomputeBox();

            if (current == root) {
                if (sibling != null) {
                    RTreeNode newRoot = RTreeNode.newInternal();
                    newRoot.addChild(current);
                    newRoot.addChild(sibling);
                    newRoot.recomputeBox();
                    root = newRoot;
                    height++;
                }
                return;
            }

            RTreeNode parent = current.parent();
            if (sibling != null) {
                parent.addChild(sibling);
            }
            current = parent;
        }
    }

    /**
     * Moves half of an overflowing node into a new sibling, which is returned.
     */
    private RTreeNode split(RTreeNode node) {
        if (node.isLeaf()) {
            List<List<SpatialEntry>> groups = partition(new ArrayList<>(node.entries()));
            RTreeNode sibling = RTreeNode.newLeaf();

            node.entries().clear();
            node.entries().addAll(groups.get(0));
            sibling.entries().addAll(groups.get(1));
            for (SpatialEntry moved : groups.get(1)) {
                leafByFeature.put(moved.featureId(), sibling);
            }
            sibling.recomputeBox();
            return sibling;
        }

        List<List<RTreeNode>> groups = partition(new ArrayList<>(node.children()));
        RTreeNode sibling = RTreeNode.newInternal();

        for (RTreeNode child : new ArrayList<>(node.children())) {
            node.removeChild(child);
        }
        groups.get(0).forEach(node::addChild);
        groups.get(1).forEach(sibling::addChild);
        sibling.recomputeBox();
        return sibling;
    }

    /**
     * Quadratic split: seed two groups with the pair that would waste the most area if kept
     * together, then give each remaining item to the group needing the least enlargement
     * (ties: smaller group area, then fewer items). A group that needs every remaining item
     * to reach {@code minEntries} takes them all.
     */
    private <T extends Bounded> List<List<T>> partition(List<T> items) {
        int[] seeds = pickSeeds(items);

        List<T> first = new ArrayList<>();
        List<T> second = new ArrayList<>();
        first.add(items.get(seeds[0]));
        second.add(items.get(seeds[1]));
        BoundingBox firstBox = items.get(seeds[0]).box();
        BoundingBox secondBox = items.get(seeds[1]).box();

        int remaining = items.size() - 2;
        for (int i = 0; i < items.size(); i++) {
            if (i == seeds[0] || i == seeds[1]) {
                continue;
            }
            T item = items.get(i);

            boolean toFirst;
            if (first.size() + remaining <= minEntries) {
                toFirst = true;
            } else if (second.size() + remaining <= minEntries) {
                toFirst = false;
            } else {
                double firstEnlargement = firstBox.enlargement(item.box());
                double secondEnlargement = secondBox.enlargement(item.box());
                if (firstEnlargement != secondEnlargement) {
                    toFirst = firstEnlargement < secondEnlargement;
                } else if (firstBox.area() != secondBox.area()) {
                    toFirst = firstBox.area() < secondBox.area();
                } else {
                    toFirst = first.size() <= second.size();
                }
            }

            if (toFirst) {
                first.add(item);
                firstBox = firstBox.union(item.box());
            } else {
                second.add(item);
                secondBox = secondBox.union(item.box());
            }
            remaining--;
        }

        return List.of(first, second);
    }

    private int[] pickSeeds(List<? extends Bounded> items) {
        int[] seeds = {0, 1};
        double worstWaste = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < items.size(); i++) {
            BoundingBox a = items.get(i).box();
            for (int j = i + 1; j < items.size(); j++) {
                BoundingBox b = items.get(j).box();
                double waste = a.union(b).area() - a.area() - b.area();
                if (waste > worstWaste) {
                    worstWaste = waste;
                    seeds[0] = i;
                    seeds[1] = j;
                }
            }
        }
        return seeds;
    }

    // ===== Deletion =====

    private void removeEntry(String featureId) {
        RTreeNode leaf = leafByFeature.remove(featureId);
        leaf.entries().removeIf(entry -> entry.featureId().equals(featureId));

        // Prune emptied nodes bottom-up; no merging of underfull ones.
        RTreeNode current = leaf;
        while (current != root && current.isEmpty()) {
            RTreeNode parent = current.parent();
            parent.removeChild(current);
            current = parent;
        }

        if (current == root && root.isEmpty() && !root.isLeaf()) {
            root = RTreeNode.newLeaf();
            height = 1;
            return;
        }

        for (RTreeNode node = current; node != null; node = node.parent()) {
            node.recomputeBox();
        }
    }
}
