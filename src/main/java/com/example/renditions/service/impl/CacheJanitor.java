package com.example.renditions.service.impl;

import com.example.renditions.service.RenditionCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically evicts cached renditions that have not been accessed within the TTL and,
 * when a size budget is configured, the least recently used ones beyond it.
 */
@Component
public class CacheJanitor {

    private static final Logger log = LoggerFactory.getLogger(CacheJanitor.class);

    private final RenditionCacheService cacheService;
    private final Duration ttl;
    private final long maxSizeBytes;

    public CacheJanitor(RenditionCacheService cacheService,
                        @Value("${transcode.cache.ttl.seconds:86400}") long ttlSeconds,
                        @Value("${transcode.cache.max-size-bytes:0}") long maxSizeBytes) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("transcode.cache.ttl.seconds cannot be negative: " + ttlSeconds);
        }
        this.cacheService = cacheService;
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.maxSizeBytes = maxSizeBytes;
    }

    @Scheduled(fixedDelayString = "${transcode.janitor.interval.millis:3600000}",
            initialDelayString = "${transcode.janitor.initial-delay.millis:60000}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[Janitor] Sweep failed; will retry on the next schedule", e);
        }
    }

    /**
     * @return The number of renditions removed.
     */
    public int sweep() {
        log.debug("[Janitor] Starting sweep (ttl {})", ttl);
        int removed = cacheService.evictOlderThan(ttl);
        if (maxSizeBytes > 0) {
            removed += cacheService.evictToSize(maxSizeBytes);
        }
        log.info("[Janitor] Sweep finished: {} rendition(s) removed, {} remain", removed, cacheService.count());
        return removed;
    }

    public Duration getTtl() {
        return ttl;
    }
}
