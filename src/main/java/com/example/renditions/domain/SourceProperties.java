package com.example.renditions.domain;

/**
 * Probed properties of a source media file. Read-only; produced by the probing collaborator.
 *
 * @param durationSeconds Container duration, 0 when unknown.
 * @param width           Width of the first video stream, 0 when there is none.
 * @param height          Height of the first video stream, 0 when there is none.
 * @param videoCodec      Codec name of the first video stream, empty when there is none.
 * @param audioCodec      Codec name of the first audio stream, empty when there is none.
 * @param bitrate         Overall container bitrate in bits per second, 0 when unknown.
 */
public record SourceProperties(
        double durationSeconds,
        int width,
        int height,
        String videoCodec,
        String audioCodec,
        long bitrate
) {

    public boolean hasVideo() {
        return height > 0;
    }

    public boolean hasDuration() {
        return durationSeconds > 0;
    }
}
