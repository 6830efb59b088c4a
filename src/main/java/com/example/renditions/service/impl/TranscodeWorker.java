package com.example.renditions.service.impl;

import com.example.renditions.domain.FailureReason;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.QualityTier;
import com.example.renditions.domain.RenditionKey;
import com.example.renditions.domain.SourceProperties;
import com.example.renditions.exceptions.EncodeProcessException;
import com.example.renditions.exceptions.EncodeTimeoutException;
import com.example.renditions.exceptions.RenditionStorageException;
import com.example.renditions.exceptions.SourceProbeException;
import com.example.renditions.service.EncodeProcess;
import com.example.renditions.service.EncodeRequest;
import com.example.renditions.service.JobStatusStore;
import com.example.renditions.service.MediaEncoder;
import com.example.renditions.service.MediaProbeService;
import com.example.renditions.service.RenditionCacheService;
import com.example.renditions.service.RenditionStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Executes one transcode job end to end on the calling thread: encode to a temporary file,
 * publish it into the cache, record the outcome. Never throws; every failure ends in a
 * terminal job state.
 */
@Component
public class TranscodeWorker {

    private static final Logger log = LoggerFactory.getLogger(TranscodeWorker.class);

    private final JobStatusStore jobStatusStore;
    private final MediaEncoder mediaEncoder;
    private final MediaProbeService mediaProbeService;
    private final RenditionStorageService storageService;
    private final RenditionCacheService cacheService;
    private final Duration maxDuration;
    private final Duration sampleInterval;

    public TranscodeWorker(JobStatusStore jobStatusStore,
                           MediaEncoder mediaEncoder,
                           MediaProbeService mediaProbeService,
                           RenditionStorageService storageService,
                           RenditionCacheService cacheService,
                           @Value("${transcode.max-duration.seconds:3600}") long maxDurationSeconds,
                           @Value("${transcode.progress.sample-interval.millis:2000}") long sampleIntervalMillis) {
        if (maxDurationSeconds <= 0) {
            throw new IllegalArgumentException("transcode.max-duration.seconds must be positive: " + maxDurationSeconds);
        }
        if (sampleIntervalMillis <= 0) {
            throw new IllegalArgumentException(
                    "transcode.progress.sample-interval.millis must be positive: " + sampleIntervalMillis);
        }
        this.jobStatusStore = jobStatusStore;
        this.mediaEncoder = mediaEncoder;
        this.mediaProbeService = mediaProbeService;
        this.storageService = storageService;
        this.cacheService = cacheService;
        this.maxDuration = Duration.ofSeconds(maxDurationSeconds);
        this.sampleInterval = Duration.ofMillis(sampleIntervalMillis);
    }

    public void execute(String jobId, QualityResolution resolution) {
        RenditionKey key = resolution.renditionKey();
        QualityTier tier = resolution.resolved();
        log.info("[Worker][Job:{}] Starting transcode of {} to {}", jobId, resolution.source().inputPath(), tier);

        try {
            jobStatusStore.markProcessing(jobId);
        } catch (RuntimeException e) {
            log.error("[Worker][Job:{}] Could not move job to PROCESSING; abandoning it", jobId, e);
            jobStatusStore.markFailed(jobId, FailureReason.INTERRUPTED, "Could not start job: " + e.getMessage());
            return;
        }

        Path temporaryOutput = null;
        EncodeProcess process = null;
        try {
            temporaryOutput = storageService.temporaryOutputPath(jobId);
            Path finalPath = storageService.renditionPath(key);

            process = mediaEncoder.start(EncodeRequest.forTier(
                    jobId, resolution.source().inputPath(), temporaryOutput, tier));
            awaitCompletion(jobId, process, sourceDuration(resolution));

            long size = storageService.publish(temporaryOutput, finalPath);
            Double duration = outputDuration(jobId, finalPath, resolution);
            cacheService.put(key.mediaId(), tier, finalPath, size, duration);
            completeOrWithdraw(jobId, key, finalPath);
            log.info("[Worker][Job:{}] Completed {} ({} bytes)", jobId, key, size);

        } catch (EncodeTimeoutException e) {
            log.warn("[Worker][Job:{}] {}", jobId, e.getMessage());
            jobStatusStore.markFailed(jobId, FailureReason.ENCODE_TIMEOUT, e.toDiagnostic());
        } catch (EncodeProcessException e) {
            log.warn("[Worker][Job:{}] Encode failed (exit code {}): {}\n{}",
                    jobId, e.getExitCode(), e.getMessage(), e.getStderrTail());
            jobStatusStore.markFailed(jobId, FailureReason.ENCODE_PROCESS_FAILED, e.toDiagnostic());
        } catch (RenditionStorageException e) {
            log.error("[Worker][Job:{}] Storage error while publishing {}", jobId, key, e);
            jobStatusStore.markFailed(jobId, FailureReason.CACHE_IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            log.warn("[Worker][Job:{}] Interrupted; terminating the encoder", jobId);
            if (process != null) {
                process.destroy();
            }
            jobStatusStore.markFailed(jobId, FailureReason.INTERRUPTED, "Transcode interrupted");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("[Worker][Job:{}] Unexpected error during transcode", jobId, e);
            jobStatusStore.markFailed(jobId, FailureReason.ENCODE_PROCESS_FAILED,
                    "Unexpected error during transcode: " + e.getMessage());
        } finally {
            if (process != null) {
                process.close();
            }
            cleanupTemporaryOutput(jobId, temporaryOutput);
        }
    }

    /**
     * Monitoring loop: waits on the process in sample-sized slices, publishing progress
     * between slices, until it exits or the maximum duration elapses.
     */
    private void awaitCompletion(String jobId, EncodeProcess process, double sourceDurationSeconds)
            throws InterruptedException {
        ProgressEstimator estimator = new ProgressEstimator(sourceDurationSeconds, maxDuration.dividedBy(10));
        Instant startedAt = Instant.now();
        Instant deadline = startedAt.plus(maxDuration);

        while (true) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                String tail = process.stderrTail();
                process.destroy();
                throw new EncodeTimeoutException(maxDuration, tail);
            }
            Duration slice = remaining.compareTo(sampleInterval) < 0 ? remaining : sampleInterval;
            if (process.waitFor(slice)) {
                break;
            }
            int progress = estimator.estimate(Duration.between(startedAt, Instant.now()), process.encodedSeconds());
            jobStatusStore.updateProgress(jobId, progress);
        }

        int exitCode = process.exitCode();
        if (exitCode != 0) {
            throw new EncodeProcessException("Encoder exited with code " + exitCode, exitCode, process.stderrTail());
        }
    }

    /**
     * A cached rendition is only visible while its job is completed, so the entry is purged
     * again when the completion cannot be recorded.
     */
    private void completeOrWithdraw(String jobId, RenditionKey key, Path finalPath) {
        try {
            jobStatusStore.markCompleted(jobId, finalPath);
        } catch (RuntimeException e) {
            log.error("[Worker][Job:{}] Could not record completion; withdrawing {} from the cache", jobId, key);
            try {
                cacheService.purge(key.mediaId(), key.tier());
            } catch (RuntimeException purgeError) {
                e.addSuppressed(purgeError);
            }
            throw e;
        }
    }

    private Double outputDuration(String jobId, Path renditionPath, QualityResolution resolution) {
        try {
            SourceProperties output = mediaProbeService.probe(renditionPath);
            if (output.hasDuration()) {
                return output.durationSeconds();
            }
        } catch (SourceProbeException e) {
            log.debug("[Worker][Job:{}] Could not probe output {}: {}", jobId, renditionPath, e.getMessage());
        }
        double source = sourceDuration(resolution);
        return source > 0 ? source : null;
    }

    private static double sourceDuration(QualityResolution resolution) {
        return resolution.source().probed()
                .filter(SourceProperties::hasDuration)
                .map(SourceProperties::durationSeconds)
                .orElse(0.0);
    }

    private void cleanupTemporaryOutput(String jobId, Path temporaryOutput) {
        if (temporaryOutput == null) {
            return;
        }
        try {
            if (storageService.delete(temporaryOutput)) {
                log.debug("[Worker][Job:{}] Removed temporary output {}", jobId, temporaryOutput);
            }
        } catch (RenditionStorageException e) {
            log.warn("[Worker][Job:{}] Failed to remove temporary output {}: {}", jobId, temporaryOutput, e.getMessage());
        }
    }
}
