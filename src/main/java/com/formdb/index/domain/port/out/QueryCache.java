package com.formdb.index.domain.port.out;

import com.formdb.index.domain.model.CacheStats;
import com.formdb.index.domain.model.QueryKey;

import java.util.Optional;

/**
 * Bounded LRU + TTL cache of read-path results.
 */
public interface QueryCache {

    /**
     * @return the cached value, or empty on a miss or an expired entry
     */
    Optional<Object> get(QueryKey key);

    /**
     * Typed lookup; a value of another type counts as a miss
     */
    default <T> Optional<T> get(QueryKey key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    void put(QueryKey key, Object value);

    /**
     * Store {@code value} only if {@code key.database()} has not been invalidated since
     * {@link #generation(String)} returned {@code observedGeneration}.
     * @return true if stored
     */
    boolean put(QueryKey key, Object value, long observedGeneration);

    /**
     * Counter advanced by every invalidation of {@code database}
     */
    long generation(String database);

    void invalidate(QueryKey key);

    void invalidateDatabase(String database);

    void invalidateAll();

    /**
     * Remove expired entries in bounded batches
     * @return number of entries removed
     */
    int sweepExpired();

    CacheStats getStats();
}
