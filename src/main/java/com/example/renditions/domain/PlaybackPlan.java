package com.example.renditions.domain;

import java.nio.file.Path;

/**
 * How a caller should serve a playback request for a given quality.
 */
public sealed interface PlaybackPlan permits PlaybackPlan.Original, PlaybackPlan.Cached, PlaybackPlan.Transcoding {

    QualityTier tier();

    /**
     * The source already matches the resolved tier; stream the original file.
     */
    record Original(Path inputPath, QualityTier tier) implements PlaybackPlan {
    }

    record Cached(Path renditionPath, QualityTier tier) implements PlaybackPlan {
    }

    /**
     * A transcode was submitted (or coalesced); poll the job for completion.
     */
    record Transcoding(String jobId, QualityTier tier) implements PlaybackPlan {
    }
}
