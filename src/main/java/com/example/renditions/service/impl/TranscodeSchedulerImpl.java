package com.example.renditions.service.impl;

import com.example.renditions.config.AsyncConfig;
import com.example.renditions.domain.CachedRendition;
import com.example.renditions.domain.FailureReason;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.RenditionKey;
import com.example.renditions.domain.TranscodeJob;
import com.example.renditions.dto.TranscodeStatistics;
import com.example.renditions.service.JobStatusStore;
import com.example.renditions.service.RenditionCacheService;
import com.example.renditions.service.RenditionStorageService;
import com.example.renditions.service.TranscodeScheduler;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class TranscodeSchedulerImpl implements TranscodeScheduler {

    private static final Logger log = LoggerFactory.getLogger(TranscodeSchedulerImpl.class);

    static final String RESTART_MESSAGE = "Interrupted by service restart";

    private final RenditionCacheService cacheService;
    private final JobStatusStore jobStatusStore;
    private final RenditionStorageService storageService;
    private final ActiveJobRegistry activeJobs;
    private final TranscodeWorker worker;
    private final ThreadPoolTaskExecutor executor;

    public TranscodeSchedulerImpl(RenditionCacheService cacheService,
                                  JobStatusStore jobStatusStore,
                                  RenditionStorageService storageService,
                                  ActiveJobRegistry activeJobs,
                                  TranscodeWorker worker,
                                  @Qualifier(AsyncConfig.TRANSCODE_EXECUTOR) ThreadPoolTaskExecutor executor) {
        this.cacheService = cacheService;
        this.jobStatusStore = jobStatusStore;
        this.storageService = storageService;
        this.activeJobs = activeJobs;
        this.worker = worker;
        this.executor = executor;
    }

    /**
     * No worker of a previous run can still own a job, so its active jobs are failed
     * and its temporary outputs discarded before anything is admitted.
     */
    @PostConstruct
    void recoverFromRestart() {
        int failed = jobStatusStore.failOrphanedJobs(RESTART_MESSAGE);
        int removed = storageService.clearTemporaryOutputs();
        log.info("[Scheduler] Startup recovery: {} orphaned job(s) failed, {} temporary file(s) removed",
                failed, removed);
    }

    @Override
    public String submit(QualityResolution resolution) {
        RenditionKey key = resolution.renditionKey();
        return activeJobs.withKeyLock(key, () -> {
            Optional<CachedRendition> cached = cacheService.get(key.mediaId(), key.tier());
            if (cached.isPresent()) {
                return jobStatusStore.createCompletedFromCache(resolution, cached.get().getOutputPath())
                        .getPublicId();
            }

            Optional<String> active = activeJobs.activeJob(key);
            if (active.isPresent()) {
                log.info("[Scheduler] Coalescing request for {} onto active job {}", key, active.get());
                return active.get();
            }

            TranscodeJob job = jobStatusStore.createPending(resolution);
            String jobId = job.getPublicId();
            activeJobs.register(key, jobId);
            dispatch(jobId, resolution);
            return jobId;
        });
    }

    @Override
    public void release(String jobId, RenditionKey key) {
        if (activeJobs.release(key, jobId)) {
            log.debug("[Scheduler] Released {} (job {})", key, jobId);
        } else {
            log.warn("[Scheduler] Release of job {} ignored: it is not the active job for {}", jobId, key);
        }
    }

    @Override
    public int activeJobCount() {
        return activeJobs.size();
    }

    @Override
    public TranscodeStatistics statistics() {
        int queued = 0;
        try {
            queued = executor.getThreadPoolExecutor().getQueue().size();
        } catch (IllegalStateException e) {
            log.debug("[Scheduler] Worker pool not initialized yet");
        }
        return new TranscodeStatistics(
                executor.getMaxPoolSize(),
                executor.getActiveCount(),
                queued,
                cacheService.count(),
                cacheService.totalSize());
    }

    // Helper methods

    private void dispatch(String jobId, QualityResolution resolution) {
        RenditionKey key = resolution.renditionKey();
        try {
            executor.execute(() -> {
                try {
                    worker.execute(jobId, resolution);
                } finally {
                    // The worker has already cached the result, so a later submit sees the cache hit
                    release(jobId, key);
                }
            });
            log.info("[Scheduler] Queued job {} for {}", jobId, key);
        } catch (TaskRejectedException e) {
            log.error("[Scheduler] Worker pool rejected job {} for {}", jobId, key, e);
            jobStatusStore.markFailed(jobId, FailureReason.INTERRUPTED, "Rejected by worker pool: " + e.getMessage());
            activeJobs.release(key, jobId);
        }
    }
}
