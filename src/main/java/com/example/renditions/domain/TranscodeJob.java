package com.example.renditions.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transcode_jobs",
        indexes = {
                @Index(name = "idx_job_public_id", columnList = "publicId", unique = true),
                @Index(name = "idx_job_media_quality", columnList = "mediaId, resolvedQuality"),
                @Index(name = "idx_job_status", columnList = "status")
        })
public class TranscodeJob {

    public static final int MAX_ERROR_MESSAGE_LENGTH = 2000;
    private static final int MAX_RUNNING_PROGRESS = 99;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false, length = 36)
    private String publicId;

    @Column(nullable = false, updatable = false)
    private String mediaId;

    @Column(nullable = false, updatable = false, length = 1024)
    private String inputPath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private QualityTier requestedQuality;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private QualityTier resolvedQuality;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobState status = JobState.PENDING;

    @Column(nullable = false)
    private int progress;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private FailureReason failureReason;

    @Column(length = MAX_ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    // Absolute path of the published rendition; set only once COMPLETED
    @Column(length = 1024)
    private String outputPath;

    // True when the job was synthesized from a cache hit and never ran an encode
    @Column(nullable = false, updatable = false)
    private boolean fromCache;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    @Version
    private Long version;

    public enum JobState {
        PENDING, // Admitted and queued, waiting for a worker slot
        PROCESSING, // A worker is running the encoder
        COMPLETED, // Rendition published to the cache
        FAILED // Terminal failure, see failureReason
    }

    protected TranscodeJob() {
    }

    private TranscodeJob(String mediaId, String inputPath, QualityTier requestedQuality, QualityTier resolvedQuality) {
        this.publicId = UUID.randomUUID().toString();
        this.mediaId = mediaId;
        this.inputPath = inputPath;
        this.requestedQuality = requestedQuality;
        this.resolvedQuality = resolvedQuality;
        this.createdAt = Instant.now();
    }

    public static TranscodeJob pending(String mediaId, String inputPath,
                                       QualityTier requestedQuality, QualityTier resolvedQuality) {
        return new TranscodeJob(mediaId, inputPath, requestedQuality, resolvedQuality);
    }

    /**
     * Creates a job that is already COMPLETED because its rendition was found in the cache.
     */
    public static TranscodeJob completedFromCache(String mediaId, String inputPath, QualityTier requestedQuality,
                                                  QualityTier resolvedQuality, String cachedPath) {
        TranscodeJob job = new TranscodeJob(mediaId, inputPath, requestedQuality, resolvedQuality);
        job.fromCache = true;
        job.status = JobState.COMPLETED;
        job.progress = 100;
        job.outputPath = cachedPath;
        job.startedAt = job.createdAt;
        job.completedAt = job.createdAt;
        return job;
    }

    public void markProcessing() {
        if (status != JobState.PENDING) {
            throw new IllegalStateException("Job " + publicId + " cannot start processing from state " + status);
        }
        status = JobState.PROCESSING;
        startedAt = Instant.now();
        progress = 0;
    }

    /**
     * Raises the advisory progress. Values never decrease and stay below 100 until completion.
     *
     * @return true if the stored progress changed.
     */
    public boolean advanceProgress(int percent) {
        if (status != JobState.PROCESSING) {
            return false;
        }
        int capped = Math.max(0, Math.min(MAX_RUNNING_PROGRESS, percent));
        if (capped <= progress) {
            return false;
        }
        progress = capped;
        return true;
    }

    public void markCompleted(String publishedPath) {
        if (status != JobState.PROCESSING) {
            throw new IllegalStateException("Job " + publicId + " cannot complete from state " + status);
        }
        if (publishedPath == null || publishedPath.isBlank()) {
            throw new IllegalArgumentException("Output path is required to complete job " + publicId);
        }
        status = JobState.COMPLETED;
        outputPath = publishedPath;
        progress = 100;
        completedAt = Instant.now();
    }

    public void markFailed(FailureReason reason, String message) {
        if (isTerminal()) {
            throw new IllegalStateException("Job " + publicId + " is already terminal: " + status);
        }
        status = JobState.FAILED;
        failureReason = reason;
        errorMessage = truncate(message == null || message.isBlank() ? reason.name() : message);
        completedAt = Instant.now();
    }

    public boolean isTerminal() {
        return status == JobState.COMPLETED || status == JobState.FAILED;
    }

    public JobStatus toStatus() {
        return switch (status) {
            case PENDING -> new JobStatus.Pending();
            case PROCESSING -> new JobStatus.Processing(progress);
            case COMPLETED -> new JobStatus.Completed(outputPath);
            case FAILED -> new JobStatus.Failed(failureReason, errorMessage);
        };
    }

    public RenditionKey renditionKey() {
        return new RenditionKey(mediaId, resolvedQuality);
    }

    private static String truncate(String message) {
        if (message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
    }

    public Long getId() {
        return id;
    }

    public String getPublicId() {
        return publicId;
    }

    public String getMediaId() {
        return mediaId;
    }

    public String getInputPath() {
        return inputPath;
    }

    public QualityTier getRequestedQuality() {
        return requestedQuality;
    }

    public QualityTier getResolvedQuality() {
        return resolvedQuality;
    }

    public JobState getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "TranscodeJob[" + publicId + ", " + mediaId + "@" + resolvedQuality + ", " + status + "]";
    }
}
