package com.formdb.index.infrastructure.cron;

import com.formdb.index.domain.model.CacheStats;
import com.formdb.index.domain.port.out.QueryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class CacheSweepScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CacheSweepScheduler.class);
    private final QueryCache queryCache;

    public CacheSweepScheduler(QueryCache queryCache) {
        this.queryCache = queryCache;
    }

    @Scheduled(fixedDelayString = "${formdb.cache.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            int removed = queryCache.sweepExpired();
            CacheStats stats = queryCache.getStats();
            logger.debug("Cache sweep removed {} expired entries. {}", removed, stats.summary());
        } catch (Exception e) {
            logger.error("Cache sweep failed", e);
        }
    }
}
