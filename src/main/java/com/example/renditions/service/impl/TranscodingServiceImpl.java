package com.example.renditions.service.impl;

import com.example.renditions.domain.CachedRendition;
import com.example.renditions.domain.PlaybackPlan;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.QualityTier;
import com.example.renditions.domain.RenditionLease;
import com.example.renditions.dto.JobStatusResponse;
import com.example.renditions.dto.TranscodeStatistics;
import com.example.renditions.exceptions.UnsupportedMediaFormatException;
import com.example.renditions.service.JobStatusStore;
import com.example.renditions.service.QualityNegotiator;
import com.example.renditions.service.RenditionCacheService;
import com.example.renditions.service.TranscodeScheduler;
import com.example.renditions.service.TranscodingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
public class TranscodingServiceImpl implements TranscodingService {

    private static final Logger log = LoggerFactory.getLogger(TranscodingServiceImpl.class);

    static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "avi", "mkv", "mov", "wmv", "flv", "webm", "m4v");
    static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "aac", "flac", "ogg", "wav", "m4a");

    private final QualityNegotiator qualityNegotiator;
    private final TranscodeScheduler scheduler;
    private final JobStatusStore jobStatusStore;
    private final RenditionCacheService cacheService;

    public TranscodingServiceImpl(QualityNegotiator qualityNegotiator,
                                  TranscodeScheduler scheduler,
                                  JobStatusStore jobStatusStore,
                                  RenditionCacheService cacheService) {
        this.qualityNegotiator = qualityNegotiator;
        this.scheduler = scheduler;
        this.jobStatusStore = jobStatusStore;
        this.cacheService = cacheService;
    }

    @Override
    public String submit(String mediaId, String inputPath, String requestedQuality) {
        QualityTier requested = QualityTier.fromLabel(requestedQuality);
        Path input = validateSource(mediaId, inputPath);

        QualityResolution resolution = qualityNegotiator.resolve(mediaId, input, requested);
        String jobId = scheduler.submit(resolution);
        log.info("Submit {} @ {} (resolved {}) -> job {}", mediaId, requested, resolution.resolved(), jobId);
        return jobId;
    }

    @Override
    public JobStatusResponse status(String jobId) {
        return JobStatusResponse.fromEntity(jobStatusStore.getStatus(jobId));
    }

    @Override
    public Optional<Path> cachedPath(String mediaId, String quality) {
        QualityTier tier = QualityTier.fromLabel(quality);
        return cacheService.get(mediaId, tier)
                .map(CachedRendition::getOutputPath)
                .map(Paths::get);
    }

    @Override
    public Optional<RenditionLease> openRendition(String mediaId, String quality) {
        QualityTier tier = QualityTier.fromLabel(quality);
        return cacheService.openLease(mediaId, tier);
    }

    @Override
    public List<String> availableQualities(String mediaId) {
        return cacheService.availableTiers(mediaId).stream()
                .map(QualityTier::label)
                .toList();
    }

    @Override
    public PlaybackPlan planPlayback(String mediaId, String inputPath, String quality) {
        QualityTier requested = QualityTier.fromLabel(quality);
        Path input = validateSource(mediaId, inputPath);

        Optional<CachedRendition> cached = cacheService.get(mediaId, requested);
        if (cached.isPresent()) {
            log.debug("Playback of {} @ {} served from cache", mediaId, requested);
            return new PlaybackPlan.Cached(Paths.get(cached.get().getOutputPath()), requested);
        }

        QualityResolution resolution = qualityNegotiator.resolve(mediaId, input, requested);
        Optional<QualityTier> capability = resolution.source().capabilityTier();
        if (capability.isPresent() && capability.get() == resolution.resolved()) {
            log.debug("Playback of {} @ {} can stream the original", mediaId, requested);
            return new PlaybackPlan.Original(input, resolution.resolved());
        }

        String jobId = scheduler.submit(resolution);
        log.info("Playback of {} @ {} needs a transcode -> job {}", mediaId, requested, jobId);
        return new PlaybackPlan.Transcoding(jobId, resolution.resolved());
    }

    @Override
    public int purgeOlderThan(Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive: " + ttl);
        }
        return cacheService.evictOlderThan(ttl);
    }

    @Override
    public boolean purge(String mediaId, String quality) {
        return cacheService.purge(mediaId, QualityTier.fromLabel(quality));
    }

    @Override
    public long pruneJobs(Duration olderThan) {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("Age must be zero or positive: " + olderThan);
        }
        return jobStatusStore.prune(olderThan);
    }

    @Override
    public TranscodeStatistics statistics() {
        return scheduler.statistics();
    }

    // Helper methods

    private static Path validateSource(String mediaId, String inputPath) {
        if (mediaId == null || mediaId.isBlank()) {
            throw new UnsupportedMediaFormatException("Media id cannot be blank.");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new UnsupportedMediaFormatException("Input path cannot be blank for media " + mediaId);
        }
        String extension = extensionOf(inputPath);
        if (!VIDEO_EXTENSIONS.contains(extension) && !AUDIO_EXTENSIONS.contains(extension)) {
            throw new UnsupportedMediaFormatException(
                    "Unsupported media format '" + extension + "' for media " + mediaId + ": " + inputPath);
        }
        try {
            return Paths.get(inputPath);
        } catch (InvalidPathException e) {
            throw new UnsupportedMediaFormatException("Invalid input path for media " + mediaId + ": " + inputPath);
        }
    }

    private static String extensionOf(String path) {
        int dot = path.lastIndexOf('.');
        int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (dot < 0 || dot < separator) {
            return "";
        }
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
