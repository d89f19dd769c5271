package com.formdb.index.infrastructure.index.temporal;

import java.util.Comparator;

/**
 * (timestamp, point id): a total order over points even when timestamps repeat.
 */
record OrderingKey(long timestamp, String pointId) implements Comparable<OrderingKey> {

    private static final Comparator<OrderingKey> ORDER = Comparator
            .comparingLong(OrderingKey::timestamp)
            .thenComparing(OrderingKey::pointId);

    /**
     * Sorts before every real key with this timestamp; the empty string is the least id.
     */
    static OrderingKey lowest(long timestamp) {
        return new OrderingKey(timestamp, "");
    }

    @Override
    public int compareTo(OrderingKey other) {
        return ORDER.compare(this, other);
    }
}
