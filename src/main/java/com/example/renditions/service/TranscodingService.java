package com.example.renditions.service;

import com.example.renditions.domain.PlaybackPlan;
import com.example.renditions.domain.RenditionLease;
import com.example.renditions.dto.JobStatusResponse;
import com.example.renditions.dto.TranscodeStatistics;
import com.example.renditions.exceptions.InvalidQualityException;
import com.example.renditions.exceptions.JobNotFoundException;
import com.example.renditions.exceptions.UnsupportedMediaFormatException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Operations exposed to the API layer. Encode failures are never thrown from here;
 * they are observed through {@link #status(String)}.
 */
public interface TranscodingService {

    /**
     * Requests a rendition of the source at the given quality.
     *
     * @param mediaId          Opaque media identifier from the catalog.
     * @param inputPath        Path of the source file.
     * @param requestedQuality Tier label such as "720p".
     * @return A job id to poll with {@link #status(String)}.
     * @throws InvalidQualityException          if the label is not a known tier.
     * @throws UnsupportedMediaFormatException if the media id or path is blank or the file type is not supported.
     */
    String submit(String mediaId, String inputPath, String requestedQuality);

    /**
     * @throws JobNotFoundException if the id is unknown.
     */
    JobStatusResponse status(String jobId);

    /**
     * Path of a trusted cached rendition for exactly this media and tier.
     *
     * @throws InvalidQualityException if the label is not a known tier.
     */
    Optional<Path> cachedPath(String mediaId, String quality);

    /**
     * Same lookup as {@link #cachedPath} but pins the file against eviction until the lease is closed.
     * Callers streaming the file should use this.
     */
    Optional<RenditionLease> openRendition(String mediaId, String quality);

    /**
     * Tier labels with a cached rendition, lowest first.
     */
    List<String> availableQualities(String mediaId);

    /**
     * Decides whether to stream the original, a cached rendition, or wait for a transcode
     * (which is submitted as a side effect).
     */
    PlaybackPlan planPlayback(String mediaId, String inputPath, String quality);

    /**
     * Runs the janitor's eviction immediately with the given TTL.
     *
     * @return The number of renditions removed.
     */
    int purgeOlderThan(Duration ttl);

    /**
     * Removes one cached rendition and its file.
     */
    boolean purge(String mediaId, String quality);

    /**
     * Drops terminal job records older than the given age.
     */
    long pruneJobs(Duration olderThan);

    TranscodeStatistics statistics();
}
