package com.example.renditions.dto;

import com.example.renditions.domain.FailureReason;
import com.example.renditions.domain.JobStatus;
import com.example.renditions.domain.TranscodeJob;

import java.time.Instant;

/**
 * Caller-facing snapshot of a transcode job. Progress is advisory only.
 */
public record JobStatusResponse(
        String jobId,
        String mediaId,
        String requestedQuality,
        String resolvedQuality,
        String status,
        int progress,
        String errorMessage,
        FailureReason failureReason,
        String outputPath,
        boolean fromCache,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    /**
     * Static factory method to create a JobStatusResponse from a TranscodeJob entity.
     *
     * @param job The TranscodeJob entity.
     * @return A new JobStatusResponse instance.
     * @throws NullPointerException if job is null.
     */
    public static JobStatusResponse fromEntity(TranscodeJob job) {
        if (job == null) {
            throw new NullPointerException("Cannot create JobStatusResponse from null TranscodeJob entity");
        }
        JobStatus state = job.toStatus();
        String errorMessage = null;
        FailureReason failureReason = null;
        String outputPath = null;
        if (state instanceof JobStatus.Failed failed) {
            errorMessage = failed.errorMessage();
            failureReason = failed.reason();
        } else if (state instanceof JobStatus.Completed completed) {
            outputPath = completed.outputPath();
        }
        return new JobStatusResponse(
                job.getPublicId(),
                job.getMediaId(),
                job.getRequestedQuality().label(),
                job.getResolvedQuality().label(),
                state.name(),
                state.progress(),
                errorMessage,
                failureReason,
                outputPath,
                job.isFromCache(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }

    public boolean isTerminal() {
        return "completed".equals(status) || "failed".equals(status);
    }
}
