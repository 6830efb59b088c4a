package com.example.renditions.service.impl;

import com.example.renditions.domain.FailureReason;
import com.example.renditions.domain.MediaSource;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.TranscodeJob;
import com.example.renditions.domain.TranscodeJob.JobState;
import com.example.renditions.exceptions.JobNotFoundException;
import com.example.renditions.repository.TranscodeJobRepository;
import com.example.renditions.service.JobStatusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

@Service
public class JobStatusStoreImpl implements JobStatusStore {

    private static final Logger log = LoggerFactory.getLogger(JobStatusStoreImpl.class);

    private static final EnumSet<JobState> ACTIVE_STATES = EnumSet.of(JobState.PENDING, JobState.PROCESSING);
    private static final EnumSet<JobState> TERMINAL_STATES = EnumSet.of(JobState.COMPLETED, JobState.FAILED);

    private final TranscodeJobRepository jobRepository;

    public JobStatusStoreImpl(TranscodeJobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob createPending(QualityResolution resolution) {
        MediaSource source = resolution.source();
        TranscodeJob job = jobRepository.save(TranscodeJob.pending(
                source.mediaId(), source.inputPath().toString(), resolution.requested(), resolution.resolved()));
        log.info("[JobStore] Created PENDING job {} for {}", job.getPublicId(), resolution.renditionKey());
        return job;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob createCompletedFromCache(QualityResolution resolution, String cachedPath) {
        MediaSource source = resolution.source();
        TranscodeJob job = jobRepository.save(TranscodeJob.completedFromCache(
                source.mediaId(), source.inputPath().toString(), resolution.requested(), resolution.resolved(),
                cachedPath));
        log.info("[JobStore] Cache hit for {}; created COMPLETED job {}", resolution.renditionKey(), job.getPublicId());
        return job;
    }

    @Override
    @Transactional(readOnly = true)
    public TranscodeJob getStatus(String jobId) throws JobNotFoundException {
        return jobRepository.findByPublicId(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob markProcessing(String jobId) {
        TranscodeJob job = getStatus(jobId);
        job.markProcessing();
        TranscodeJob saved = jobRepository.save(job);
        log.info("[JobStore] Job {} is PROCESSING", jobId);
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateProgress(String jobId, int percent) {
        jobRepository.findByPublicId(jobId).ifPresentOrElse(job -> {
            if (job.advanceProgress(percent)) {
                jobRepository.save(job);
                log.debug("[JobStore] Job {} progress {}%", jobId, job.getProgress());
            }
        }, () -> log.warn("[JobStore] Progress update for unknown job {}", jobId));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TranscodeJob markCompleted(String jobId, Path outputPath) {
        if (outputPath == null) {
            throw new IllegalArgumentException("Output path is required to complete job " + jobId);
        }
        TranscodeJob job = jobRepository.findByPublicId(jobId)
                .orElseThrow(() -> {
                    log.error("[JobStore] Job not found for completion: {}", jobId);
                    return new IllegalStateException("Job not found: " + jobId);
                });
        job.markCompleted(outputPath.toAbsolutePath().toString());
        TranscodeJob saved = jobRepository.save(job);
        log.info("[JobStore] Job {} COMPLETED: {}", jobId, saved.getOutputPath());
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(String jobId, FailureReason reason, String errorMessage) {
        try {
            TranscodeJob job = jobRepository.findByPublicId(jobId).orElse(null);
            if (job == null) {
                log.error("[JobStore] Job {} not found during failure update.", jobId);
                return;
            }
            if (job.isTerminal()) {
                log.warn("[JobStore] Job {} already terminal ({}); not recording failure {}",
                        jobId, job.getStatus(), reason);
                return;
            }
            job.markFailed(reason, errorMessage);
            jobRepository.save(job);
            log.info("[JobStore] Job {} FAILED ({}): {}", jobId, reason, job.getErrorMessage());
        } catch (Exception e) {
            log.error("[JobStore] CRITICAL: Failed to record FAILED status for job {}", jobId, e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int failOrphanedJobs(String reasonMessage) {
        List<TranscodeJob> orphans = jobRepository.findByStatusIn(ACTIVE_STATES);
        for (TranscodeJob job : orphans) {
            job.markFailed(FailureReason.INTERRUPTED, reasonMessage);
            jobRepository.save(job);
        }
        if (!orphans.isEmpty()) {
            log.warn("[JobStore] Marked {} orphaned job(s) as FAILED: {}", orphans.size(), reasonMessage);
        }
        return orphans.size();
    }

    @Override
    @Transactional
    public long prune(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        long removed = jobRepository.deleteByStatusInAndCompletedAtBefore(TERMINAL_STATES, cutoff);
        log.info("[JobStore] Pruned {} terminal job record(s) completed before {}", removed, cutoff);
        return removed;
    }
}
