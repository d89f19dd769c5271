package com.formdb.index.infrastructure.cache;

import com.formdb.index.domain.model.CacheStats;
import com.formdb.index.domain.model.QueryKey;
import com.formdb.index.domain.port.out.QueryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory query cache with global LRU eviction and per-entry TTL.
 *
 * <p>Every operation runs under one lock. Entries live in an access-ordered map whose head is
 * always the least recently used entry, so eviction considers the whole live set. A second
 * structure orders entries by expiry so the sweeper can drop expired entries in batches,
 * releasing the lock between batches.
 */
@Component
public class LruTtlQueryCache implements QueryCache {

    private static final Logger logger = LoggerFactory.getLogger(LruTtlQueryCache.class);

    private final int capacity;
    private final Duration ttl;
    private final int sweepBatchSize;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<QueryKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final TreeSet<ExpiryMark> expiryQueue = new TreeSet<>();
    private final Map<String, Long> generations = new HashMap<>();
    private long globalGeneration;
    private long sequence;

    // Cache statistics
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    public LruTtlQueryCache(QueryCacheConfig config, Clock clock) {
        if (config.getCapacity() <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + config.getCapacity());
        }
        if (config.getTtlSeconds() <= 0) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + config.getTtlSeconds());
        }
        this.capacity = config.getCapacity();
        this.ttl = config.ttl();
        this.sweepBatchSize = Math.max(1, config.getSweepBatchSize());
        this.clock = clock;
    }

    @Override
    public Optional<Object> get(QueryKey key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }

            if (!clock.instant().isBefore(entry.expiresAt)) {
                entries.remove(key);
                expiryQueue.remove(entry.mark);
                expirations.incrementAndGet();
                misses.incrementAndGet();
                logger.debug("Expired entry removed on read: {}", key);
                return Optional.empty();
            }

            hits.incrementAndGet();
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(QueryKey key, Object value) {
        lock.lock();
        try {
            store(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean put(QueryKey key, Object value, long observedGeneration) {
        lock.lock();
        try {
            if (currentGeneration(key.database()) != observedGeneration) {
                logger.debug("Skipping stale put for {}: database invalidated since read began", key);
                return false;
            }
            store(key, value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long generation(String database) {
        lock.lock();
        try {
            return currentGeneration(database);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate(QueryKey key) {
        lock.lock();
        try {
            CacheEntry entry = entries.remove(key);
            if (entry != null) {
                expiryQueue.remove(entry.mark);
                invalidations.incrementAndGet();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateDatabase(String database) {
        lock.lock();
        try {
            generations.merge(database, 1L, Long::sum);

            int removed = 0;
            Iterator<Map.Entry<QueryKey, CacheEntry>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<QueryKey, CacheEntry> candidate = iterator.next();
                if (candidate.getKey().belongsTo(database)) {
                    expiryQueue.remove(candidate.getValue().mark);
                    iterator.remove();
                    removed++;
                }
            }

            invalidations.addAndGet(removed);
            logger.debug("Invalidated {} cache entries for database {}", removed, database);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            globalGeneration++;
            int removed = entries.size();
            entries.clear();
            expiryQueue.clear();
            invalidations.addAndGet(removed);
            logger.info("Cleared entire query cache ({} entries)", removed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int sweepExpired() {
        int removed = 0;
        boolean drained = false;

        while (!drained) {
            int batch = 0;
            lock.lock();
            try {
                Instant now = clock.instant();
                while (batch < sweepBatchSize) {
                    if (expiryQueue.isEmpty() || now.isBefore(expiryQueue.first().expiresAt())) {
                        drained = true;
                        break;
                    }
                    ExpiryMark mark = expiryQueue.pollFirst();
                    entries.remove(mark.key());
                    batch++;
                }
            } finally {
                lock.unlock();
            }

            removed += batch;
            expirations.addAndGet(batch);
            if (!drained) {
                // let queued foreground calls in before the next batch
                Thread.yield();
            }
        }

        if (removed > 0) {
            logger.debug("Sweep removed {} expired cache entries", removed);
        }
        return removed;
    }

    @Override
    public CacheStats getStats() {
        lock.lock();
        try {
            return new CacheStats(
                    entries.size(),
                    capacity,
                    ttl,
                    hits.get(),
                    misses.get(),
                    evictions.get(),
                    expirations.get(),
                    invalidations.get()
            );
        } finally {
            lock.unlock();
        }
    }

    // ===== Private Helper Methods =====

    private void store(QueryKey key, Object value) {
        Instant now = clock.instant();
        CacheEntry existing = entries.get(key);

        if (existing != null) {
            expiryQueue.remove(existing.mark);
        } else if (entries.size() >= capacity) {
            evictLeastRecentlyUsed();
        }

        ExpiryMark mark = new ExpiryMark(now.plus(ttl), sequence++, key);
        entries.put(key, new CacheEntry(value, mark));
        expiryQueue.add(mark);
    }

    private void evictLeastRecentlyUsed() {
        Iterator<Map.Entry<QueryKey, CacheEntry>> iterator = entries.entrySet().iterator();
        if (!iterator.hasNext()) {
            return;
        }
        Map.Entry<QueryKey, CacheEntry> eldest = iterator.next();
        expiryQueue.remove(eldest.getValue().mark);
        iterator.remove();
        evictions.incrementAndGet();
        logger.debug("Evicted least recently used entry {}", eldest.getKey());
    }

    // Sum of two monotonic counters, so it moves whenever either one does.
    private long currentGeneration(String database) {
        return globalGeneration + generations.getOrDefault(database, 0L);
    }

    // Recency lives in the access order of the entries map
    private static final class CacheEntry {
        private final Object value;
        private final Instant expiresAt;
        private final ExpiryMark mark;

        private CacheEntry(Object value, ExpiryMark mark) {
            this.value = value;
            this.expiresAt = mark.expiresAt();
            this.mark = mark;
        }
    }

    private record ExpiryMark(Instant expiresAt, long sequence, QueryKey key) implements Comparable<ExpiryMark> {

        @Override
        public int compareTo(ExpiryMark other) {
            int byExpiry = expiresAt.compareTo(other.expiresAt);
            return byExpiry != 0 ? byExpiry : Long.compare(sequence, other.sequence);
        }
    }
}
