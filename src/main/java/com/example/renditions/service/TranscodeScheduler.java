package com.example.renditions.service;

import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.RenditionKey;
import com.example.renditions.dto.TranscodeStatistics;

/**
 * Entry point for transcode work: cache hits are answered immediately, duplicate requests
 * are coalesced onto the active job, and new jobs are queued for a bounded worker pool.
 */
public interface TranscodeScheduler {

    /**
     * Never blocks on encoding.
     *
     * @return The id of a completed cache-hit job, of the already active job for the same
     *         rendition, or of a newly queued job.
     */
    String submit(QualityResolution resolution);

    /**
     * Called by the worker once a job reached a terminal state and its result, if any, is cached.
     */
    void release(String jobId, RenditionKey key);

    /**
     * Jobs currently registered as active (queued or running).
     */
    int activeJobCount();

    TranscodeStatistics statistics();
}
