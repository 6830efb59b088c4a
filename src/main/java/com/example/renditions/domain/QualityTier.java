package com.example.renditions.domain;

import com.example.renditions.exceptions.InvalidQualityException;

import java.util.Locale;

/**
 * Fixed, totally ordered set of rendition profiles. Declaration order is the quality order,
 * lowest first, so {@link #compareTo(Enum)} can be used to compare tiers.
 */
public enum QualityTier {
    P240("240p", 426, 240, 500_000L, 64_000L, 28),
    P360("360p", 640, 360, 800_000L, 96_000L, 26),
    P480("480p", 854, 480, 1_200_000L, 128_000L, 24),
    P720("720p", 1280, 720, 2_500_000L, 192_000L, 22),
    P1080("1080p", 1920, 1080, 5_000_000L, 256_000L, 20),
    UHD_4K("4k", 3840, 2160, 15_000_000L, 320_000L, 18);

    private final String label;
    private final int width;
    private final int height;
    private final long videoBitrate; // bits per second
    private final long audioBitrate; // bits per second
    private final int qualityFactor; // x264 CRF

    QualityTier(String label, int width, int height, long videoBitrate, long audioBitrate, int qualityFactor) {
        this.label = label;
        this.width = width;
        this.height = height;
        this.videoBitrate = videoBitrate;
        this.audioBitrate = audioBitrate;
        this.qualityFactor = qualityFactor;
    }

    /**
     * Parses a tier label such as {@code "720p"} or {@code "4K"} (case-insensitive).
     *
     * @param label The requested label.
     * @return The matching tier.
     * @throws InvalidQualityException if the label is blank or not a known tier.
     */
    public static QualityTier fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidQualityException(label);
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (QualityTier tier : values()) {
            if (tier.label.equals(normalized)) {
                return tier;
            }
        }
        throw new InvalidQualityException(label);
    }

    /**
     * The highest tier a source of the given height can fill without upscaling.
     * Heights above 1080 map to 4k; anything up to 240 (including unknown, non-positive heights) maps to 240p.
     */
    public static QualityTier forSourceHeight(int sourceHeight) {
        for (QualityTier tier : values()) {
            if (sourceHeight <= tier.height) {
                return tier;
            }
        }
        return UHD_4K;
    }

    public static QualityTier lower(QualityTier a, QualityTier b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public String label() {
        return label;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public long videoBitrate() {
        return videoBitrate;
    }

    public long audioBitrate() {
        return audioBitrate;
    }

    public int qualityFactor() {
        return qualityFactor;
    }

    public String resolution() {
        return width + "x" + height;
    }

    @Override
    public String toString() {
        return label;
    }
}
