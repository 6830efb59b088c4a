package com.example.renditions.domain;

import java.util.Objects;

/**
 * Identity of a rendition: one source media item at one quality tier.
 * Used as the coalescing key for active jobs and the lookup key of the rendition cache.
 */
public record RenditionKey(String mediaId, QualityTier tier) {

    public RenditionKey {
        Objects.requireNonNull(mediaId, "mediaId");
        Objects.requireNonNull(tier, "tier");
    }

    @Override
    public String toString() {
        return mediaId + "@" + tier.label();
    }
}
