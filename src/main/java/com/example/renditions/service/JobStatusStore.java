package com.example.renditions.service;

import com.example.renditions.domain.FailureReason;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.TranscodeJob;
import com.example.renditions.exceptions.JobNotFoundException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Durable record of every job's lifecycle: PENDING, then PROCESSING, then COMPLETED or FAILED.
 * No transition leaves a terminal state.
 */
public interface JobStatusStore {

    TranscodeJob createPending(QualityResolution resolution);

    /**
     * Records a job that is complete on arrival because the rendition was already cached.
     */
    TranscodeJob createCompletedFromCache(QualityResolution resolution, String cachedPath);

    /**
     * @throws JobNotFoundException if no job has the id.
     */
    TranscodeJob getStatus(String jobId) throws JobNotFoundException;

    /**
     * Moves a PENDING job to PROCESSING.
     *
     * @throws JobNotFoundException if no job has the id.
     * @throws IllegalStateException if the job is not PENDING.
     */
    TranscodeJob markProcessing(String jobId);

    /**
     * Stores an advisory progress value. Ignored unless the job is PROCESSING and the value is higher.
     */
    void updateProgress(String jobId, int percent);

    TranscodeJob markCompleted(String jobId, Path outputPath);

    /**
     * Records a terminal failure. A job already in a terminal state is left untouched.
     */
    void markFailed(String jobId, FailureReason reason, String errorMessage);

    /**
     * Fails every PENDING or PROCESSING job. Used at startup, when no worker can still own them.
     *
     * @return The number of jobs failed.
     */
    int failOrphanedJobs(String reasonMessage);

    /**
     * Drops terminal records that completed before {@code now - olderThan}. Never called internally.
     *
     * @return The number of records removed.
     */
    long prune(Duration olderThan);
}
