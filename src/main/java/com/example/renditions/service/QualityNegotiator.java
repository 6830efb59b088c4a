package com.example.renditions.service;

import com.example.renditions.domain.MediaSource;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.QualityTier;

import java.nio.file.Path;

/**
 * Picks the tier that will actually be encoded. Never upscales.
 */
public interface QualityNegotiator {

    /**
     * Probes the source and resolves the target tier. A failed probe is not an error:
     * the requested tier is used as a best-effort fallback.
     */
    QualityResolution resolve(String mediaId, Path inputPath, QualityTier requested);

    /**
     * Pure negotiation against an already described source:
     * {@code min(requested, capability)}, or {@code requested} when the capability is unknown.
     */
    QualityTier negotiate(MediaSource source, QualityTier requested);
}
