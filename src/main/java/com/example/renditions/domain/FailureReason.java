package com.example.renditions.domain;

public enum FailureReason {
    ENCODE_PROCESS_FAILED, // Non-zero exit, crash, or the encoder could not be started
    ENCODE_TIMEOUT, // Exceeded the configured max duration and was killed
    CACHE_IO_ERROR, // Publishing the output into the cache failed
    INTERRUPTED // Worker interrupted or service restarted while the job was active
}
