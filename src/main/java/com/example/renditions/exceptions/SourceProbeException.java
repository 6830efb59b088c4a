package com.example.renditions.exceptions;

/**
 * The probing collaborator could not describe a source file. Callers degrade to
 * best-effort behaviour instead of failing.
 */
public class SourceProbeException extends RuntimeException {
    public SourceProbeException(String message) {
        super(message);
    }

    public SourceProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
