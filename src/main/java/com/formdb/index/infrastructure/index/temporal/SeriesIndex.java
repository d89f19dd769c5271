package com.formdb.index.infrastructure.index.temporal;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ordered index of one series. Skip list gives O(log n) insert and ordered sub-range views;
 * the lock serializes writers and lets a range read see a single consistent state.
 */
final class SeriesIndex {

    private final ConcurrentSkipListSet<OrderingKey> keys = new ConcurrentSkipListSet<>();
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    /**
     * @return false if the exact key was already present
     */
    boolean insert(String pointId, long timestamp) {
        rwLock.writeLock().lock();
        try {
            return keys.add(new OrderingKey(timestamp, pointId));
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * @return false if the exact key was absent
     */
    boolean remove(String pointId, long timestamp) {
        rwLock.writeLock().lock();
        try {
            return keys.remove(new OrderingKey(timestamp, pointId));
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    List<String> range(long start, long end, int limit) {
        rwLock.readLock().lock();
        try {
            OrderingKey from = OrderingKey.lowest(start);
            NavigableSet<OrderingKey> view = end == Long.MAX_VALUE
                    ? keys.tailSet(from, true)
                    : keys.subSet(from, true, OrderingKey.lowest(end + 1), false);

            List<String> ids = new ArrayList<>(Math.min(limit, 64));
            for (OrderingKey key : view) {
                if (ids.size() >= limit) {
                    break;
                }
                ids.add(key.pointId());
            }
            return ids;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    int size() {
        rwLock.readLock().lock();
        try {
            return keys.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
