package com.example.renditions.domain;

/**
 * Outcome of quality negotiation. {@code resolved} never exceeds {@code requested}
 * nor the source's capability tier when the source could be probed.
 */
public record QualityResolution(MediaSource source, QualityTier requested, QualityTier resolved) {

    public RenditionKey renditionKey() {
        return new RenditionKey(source.mediaId(), resolved);
    }

    public boolean isDownscaled() {
        return resolved.compareTo(requested) < 0;
    }
}
