package com.example.renditions.dto;

public record TranscodeStatistics(
        int maxConcurrentTranscodes,
        int activeTranscodes,
        int queuedTranscodes,
        long cachedRenditions,
        long cachedBytes
) {
}
