package com.example.renditions.service;

import com.example.renditions.domain.CachedRendition;
import com.example.renditions.domain.QualityTier;
import com.example.renditions.domain.RenditionLease;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from (media id, tier) to a completed rendition on disk.
 * At most one entry exists per key, and an entry is only returned while its file exists.
 */
public interface RenditionCacheService {

    /**
     * Looks up a rendition. A row whose file has disappeared is deleted and reported as absent.
     * A hit refreshes the entry's last-access time.
     */
    Optional<CachedRendition> get(String mediaId, QualityTier tier);

    /**
     * Inserts or replaces the entry for the key with fresh timestamps. The last writer's metadata stands.
     */
    CachedRendition put(String mediaId, QualityTier tier, Path outputPath, long fileSize, Double duration);

    /**
     * Like {@link #get} but pins the rendition until the returned lease is closed.
     */
    Optional<RenditionLease> openLease(String mediaId, QualityTier tier);

    /**
     * Tiers with a trusted rendition for the media, lowest first. Does not refresh access times.
     */
    List<QualityTier> availableTiers(String mediaId);

    /**
     * Deletes entries (and, best effort, their files) not accessed within the TTL.
     * Pinned entries are skipped until a later sweep.
     *
     * @return The number of entries removed.
     */
    int evictOlderThan(Duration ttl);

    /**
     * Evicts least-recently-accessed unpinned entries until the total size is within the budget.
     *
     * @return The number of entries removed.
     */
    int evictToSize(long maxTotalBytes);

    /**
     * Removes one entry and its file.
     *
     * @return true if an entry existed.
     */
    boolean purge(String mediaId, QualityTier tier);

    long count();

    long totalSize();
}
