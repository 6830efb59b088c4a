package com.example.renditions.service;

import com.example.renditions.domain.QualityTier;

import java.nio.file.Path;

/**
 * Everything the encoder needs for one rendition: input, output and the tier's fixed parameters.
 */
public record EncodeRequest(
        String jobId,
        Path inputPath,
        Path outputPath,
        long videoBitrate,
        long audioBitrate,
        int width,
        int height,
        int qualityFactor
) {

    public static EncodeRequest forTier(String jobId, Path inputPath, Path outputPath, QualityTier tier) {
        return new EncodeRequest(jobId, inputPath, outputPath,
                tier.videoBitrate(), tier.audioBitrate(), tier.width(), tier.height(), tier.qualityFactor());
    }
}
