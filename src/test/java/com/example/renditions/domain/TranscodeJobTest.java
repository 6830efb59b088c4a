package com.example.renditions.domain;

import com.example.renditions.domain.TranscodeJob.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TranscodeJob Lifecycle Tests")
class TranscodeJobTest {

    private TranscodeJob job;

    @BeforeEach
    void setUp() {
        job = TranscodeJob.pending("7", "/m/7.mkv", QualityTier.P1080, QualityTier.P720);
    }

    @Test
    @DisplayName("✅ pending: New job is PENDING with a public id and no timestamps beyond creation")
    void pending_InitialState() {
        assertThat(job.getStatus()).isEqualTo(JobState.PENDING);
        assertThat(job.getPublicId()).isNotBlank();
        assertThat(job.getProgress()).isZero();
        assertThat(job.getCreatedAt()).isNotNull();
        assertThat(job.getStartedAt()).isNull();
        assertThat(job.getCompletedAt()).isNull();
        assertThat(job.isFromCache()).isFalse();
        assertThat(job.toStatus()).isEqualTo(new JobStatus.Pending());
        assertThat(job.renditionKey()).isEqualTo(new RenditionKey("7", QualityTier.P720));
    }

    @Test
    @DisplayName("✅ completedFromCache: Job is COMPLETED on creation with identical timestamps")
    void completedFromCache_State() {
        TranscodeJob hit = TranscodeJob.completedFromCache("7", "/m/7.mkv", QualityTier.P720, QualityTier.P720,
                "/cache/7/720p.mp4");

        assertThat(hit.getStatus()).isEqualTo(JobState.COMPLETED);
        assertThat(hit.isFromCache()).isTrue();
        assertThat(hit.getProgress()).isEqualTo(100);
        assertThat(hit.getStartedAt()).isEqualTo(hit.getCreatedAt());
        assertThat(hit.getCompletedAt()).isEqualTo(hit.getCreatedAt());
        assertThat(hit.toStatus()).isEqualTo(new JobStatus.Completed("/cache/7/720p.mp4"));
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("✅ PENDING -> PROCESSING -> COMPLETED")
        void happyPath() {
            job.markProcessing();
            assertThat(job.getStatus()).isEqualTo(JobState.PROCESSING);
            assertThat(job.getStartedAt()).isNotNull();

            job.markCompleted("/cache/7/720p.mp4");
            assertThat(job.getStatus()).isEqualTo(JobState.COMPLETED);
            assertThat(job.getProgress()).isEqualTo(100);
            assertThat(job.getOutputPath()).isEqualTo("/cache/7/720p.mp4");
            assertThat(job.getCompletedAt()).isNotNull();
            assertThat(job.isTerminal()).isTrue();
        }

        @Test
        @DisplayName("✅ PENDING -> FAILED keeps the reason and message")
        void pendingToFailed() {
            job.markFailed(FailureReason.INTERRUPTED, "Interrupted by service restart");

            assertThat(job.toStatus()).isEqualTo(
                    new JobStatus.Failed(FailureReason.INTERRUPTED, "Interrupted by service restart"));
            assertThat(job.getCompletedAt()).isNotNull();
        }

        @Test
        @DisplayName("✅ markFailed: Blank message falls back to the reason name")
        void markFailed_BlankMessage() {
            job.markProcessing();
            job.markFailed(FailureReason.ENCODE_TIMEOUT, "  ");

            assertThat(job.getErrorMessage()).isEqualTo("ENCODE_TIMEOUT");
        }

        @Test
        @DisplayName("✅ markFailed: Overlong message is truncated")
        void markFailed_TruncatesMessage() {
            job.markProcessing();
            job.markFailed(FailureReason.ENCODE_PROCESS_FAILED, "x".repeat(5000));

            assertThat(job.getErrorMessage()).hasSize(TranscodeJob.MAX_ERROR_MESSAGE_LENGTH).endsWith("...");
        }

        @Test
        @DisplayName("❌ markProcessing: Rejected unless PENDING")
        void markProcessing_NotPending() {
            job.markProcessing();

            assertThatThrownBy(job::markProcessing).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("❌ markCompleted: Rejected from PENDING")
        void markCompleted_FromPending() {
            assertThatThrownBy(() -> job.markCompleted("/cache/out.mp4"))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("❌ markCompleted: Blank output path is rejected")
        void markCompleted_BlankPath() {
            job.markProcessing();

            assertThatThrownBy(() -> job.markCompleted(" ")).isInstanceOf(IllegalArgumentException.class);
            assertThat(job.getStatus()).isEqualTo(JobState.PROCESSING);
        }

        @Test
        @DisplayName("❌ Terminal states are never left")
        void terminal_IsFinal() {
            job.markProcessing();
            job.markCompleted("/cache/out.mp4");

            assertThatThrownBy(() -> job.markFailed(FailureReason.CACHE_IO_ERROR, "late"))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(job::markProcessing).isInstanceOf(IllegalStateException.class);
            assertThat(job.getStatus()).isEqualTo(JobState.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Progress")
    class Progress {

        @Test
        @DisplayName("⚠️ Ignored while PENDING")
        void ignoredWhilePending() {
            assertThat(job.advanceProgress(40)).isFalse();
            assertThat(job.getProgress()).isZero();
        }

        @Test
        @DisplayName("✅ Monotonic and capped below 100 while PROCESSING")
        void monotonicAndCapped() {
            job.markProcessing();

            assertThat(job.advanceProgress(30)).isTrue();
            assertThat(job.advanceProgress(20)).isFalse();
            assertThat(job.getProgress()).isEqualTo(30);

            assertThat(job.advanceProgress(150)).isTrue();
            assertThat(job.getProgress()).isEqualTo(99);
            assertThat(job.toStatus()).isEqualTo(new JobStatus.Processing(99));
        }
    }
}
