package com.example.renditions.service.impl;

import com.example.renditions.domain.CachedRendition;
import com.example.renditions.domain.QualityTier;
import com.example.renditions.domain.RenditionKey;
import com.example.renditions.domain.RenditionLease;
import com.example.renditions.exceptions.RenditionStorageException;
import com.example.renditions.repository.CachedRenditionRepository;
import com.example.renditions.service.RenditionCacheService;
import com.example.renditions.service.RenditionStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Database-backed rendition cache. Every read and write of a key happens under that key's lock,
 * so lookups, inserts and evictions of the same rendition never interleave.
 */
@Service
public class RenditionCacheServiceImpl implements RenditionCacheService {

    private static final Logger log = LoggerFactory.getLogger(RenditionCacheServiceImpl.class);

    private final CachedRenditionRepository renditionRepository;
    private final RenditionStorageService storageService;
    private final KeyedLocks locks = new KeyedLocks();
    private final Map<RenditionKey, AtomicInteger> leases = new ConcurrentHashMap<>();

    public RenditionCacheServiceImpl(CachedRenditionRepository renditionRepository,
                                     RenditionStorageService storageService) {
        this.renditionRepository = renditionRepository;
        this.storageService = storageService;
    }

    @Override
    public Optional<CachedRendition> get(String mediaId, QualityTier tier) {
        RenditionKey key = new RenditionKey(mediaId, tier);
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            return lookup(key, true);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CachedRendition put(String mediaId, QualityTier tier, Path outputPath, long fileSize, Double duration) {
        RenditionKey key = new RenditionKey(mediaId, tier);
        String path = outputPath.toAbsolutePath().toString();
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            CachedRendition entry = renditionRepository.findByMediaIdAndQualityTier(mediaId, tier)
                    .map(existing -> {
                        existing.replaceArtifact(path, fileSize, duration);
                        return existing;
                    })
                    .orElseGet(() -> new CachedRendition(mediaId, tier, path, fileSize, duration));
            CachedRendition saved = renditionRepository.save(entry);
            log.info("[Cache] Stored rendition {} -> {} ({} bytes)", key, path, fileSize);
            return saved;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RenditionLease> openLease(String mediaId, QualityTier tier) {
        RenditionKey key = new RenditionKey(mediaId, tier);
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            return lookup(key, true).map(entry -> {
                leases.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
                log.debug("[Cache] Lease opened on {}", key);
                return new RenditionLease(key, Paths.get(entry.getOutputPath()), entry.getFileSize(),
                        () -> releaseLease(key));
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<QualityTier> availableTiers(String mediaId) {
        List<QualityTier> tiers = new ArrayList<>();
        for (CachedRendition entry : renditionRepository.findByMediaId(mediaId)) {
            RenditionKey key = entry.renditionKey();
            ReentrantLock lock = locks.lockFor(key);
            lock.lock();
            try {
                lookup(key, false).ifPresent(trusted -> tiers.add(trusted.getQualityTier()));
            } finally {
                lock.unlock();
            }
        }
        tiers.sort(Comparator.naturalOrder());
        return tiers;
    }

    @Override
    public int evictOlderThan(Duration ttl) {
        Instant cutoff = Instant.now().minus(ttl);
        List<CachedRendition> candidates = renditionRepository.findByLastAccessedAtBefore(cutoff);
        log.debug("[Cache] {} eviction candidate(s) not accessed since {}", candidates.size(), cutoff);
        int removed = 0;
        for (CachedRendition candidate : candidates) {
            try {
                if (evictIf(candidate.renditionKey(), entry -> entry.isStale(cutoff))) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.error("[Cache] Failed to evict {}; continuing with the next entry", candidate.renditionKey(), e);
            }
        }
        if (removed > 0) {
            log.info("[Cache] Evicted {} rendition(s) older than {}", removed, ttl);
        }
        return removed;
    }

    @Override
    public int evictToSize(long maxTotalBytes) {
        long total = totalSize();
        if (total <= maxTotalBytes) {
            return 0;
        }
        int removed = 0;
        for (CachedRendition candidate : renditionRepository.findAllByOrderByLastAccessedAtAsc()) {
            if (total <= maxTotalBytes) {
                break;
            }
            try {
                if (evictIf(candidate.renditionKey(), entry -> true)) {
                    total -= candidate.getFileSize();
                    removed++;
                }
            } catch (RuntimeException e) {
                log.error("[Cache] Failed to evict {}; continuing with the next entry", candidate.renditionKey(), e);
            }
        }
        log.info("[Cache] Size-based eviction removed {} rendition(s); {} bytes remain (budget {})",
                removed, total, maxTotalBytes);
        return removed;
    }

    @Override
    public boolean purge(String mediaId, QualityTier tier) {
        RenditionKey key = new RenditionKey(mediaId, tier);
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            Optional<CachedRendition> entry = renditionRepository.findByMediaIdAndQualityTier(mediaId, tier);
            entry.ifPresent(this::remove);
            return entry.isPresent();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long count() {
        return renditionRepository.count();
    }

    @Override
    public long totalSize() {
        return renditionRepository.sumFileSize();
    }

    int activeLeases(RenditionKey key) {
        AtomicInteger count = leases.get(key);
        return count == null ? 0 : count.get();
    }

    // Helper methods

    /**
     * Reads the entry for a key, dropping it when its file no longer exists. Must hold the key's lock.
     */
    private Optional<CachedRendition> lookup(RenditionKey key, boolean touch) {
        Optional<CachedRendition> found = renditionRepository.findByMediaIdAndQualityTier(key.mediaId(), key.tier());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        CachedRendition entry = found.get();
        if (!storageService.exists(Paths.get(entry.getOutputPath()))) {
            log.warn("[Cache] File for {} is missing at {}; dropping the stale entry", key, entry.getOutputPath());
            renditionRepository.delete(entry);
            return Optional.empty();
        }
        if (touch) {
            entry.touch();
            entry = renditionRepository.save(entry);
        }
        return Optional.of(entry);
    }

    private boolean evictIf(RenditionKey key, Predicate<CachedRendition> condition) {
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            Optional<CachedRendition> current =
                    renditionRepository.findByMediaIdAndQualityTier(key.mediaId(), key.tier());
            if (current.isEmpty() || !condition.test(current.get())) {
                return false;
            }
            if (activeLeases(key) > 0) {
                log.debug("[Cache] Skipping eviction of {}: {} active lease(s)", key, activeLeases(key));
                return false;
            }
            remove(current.get());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void remove(CachedRendition entry) {
        try {
            storageService.delete(Paths.get(entry.getOutputPath()));
        } catch (RenditionStorageException e) {
            log.warn("[Cache] Could not delete file {} for {}. Removing the entry anyway. Reason: {}",
                    entry.getOutputPath(), entry.renditionKey(), e.getMessage());
        }
        renditionRepository.delete(entry);
        log.info("[Cache] Removed rendition {}", entry.renditionKey());
    }

    private void releaseLease(RenditionKey key) {
        leases.computeIfPresent(key, (k, count) -> count.decrementAndGet() <= 0 ? null : count);
        log.debug("[Cache] Lease released on {}", key);
    }
}
