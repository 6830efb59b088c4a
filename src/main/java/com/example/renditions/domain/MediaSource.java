package com.example.renditions.domain;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A source media item as seen by this subsystem: its opaque identifier, where the file lives,
 * and its probed properties when probing succeeded.
 */
public record MediaSource(String mediaId, Path inputPath, SourceProperties properties) {

    public static MediaSource unprobed(String mediaId, Path inputPath) {
        return new MediaSource(mediaId, inputPath, null);
    }

    public Optional<SourceProperties> probed() {
        return Optional.ofNullable(properties);
    }

    /**
     * Capability tier of the source, present only when probing found a video stream.
     */
    public Optional<QualityTier> capabilityTier() {
        return probed()
                .filter(SourceProperties::hasVideo)
                .map(p -> QualityTier.forSourceHeight(p.height()));
    }
}
