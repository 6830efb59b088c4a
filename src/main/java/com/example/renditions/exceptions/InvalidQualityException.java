package com.example.renditions.exceptions;

/**
 * Thrown synchronously when a caller requests a quality tier that does not exist.
 */
public class InvalidQualityException extends RuntimeException {

    private final String requestedQuality;

    public InvalidQualityException(String requestedQuality) {
        super("Unsupported quality tier: '" + requestedQuality + "'. Expected one of 240p, 360p, 480p, 720p, 1080p, 4k.");
        this.requestedQuality = requestedQuality;
    }

    public String getRequestedQuality() {
        return requestedQuality;
    }
}
