package com.example.renditions.exceptions;

/**
 * Failure of the external encode process: it could not be started, exited non-zero,
 * or produced no output. Recorded into the job's terminal state, never surfaced to submitters.
 */
public class EncodeProcessException extends RuntimeException {

    private final Integer exitCode; // null when the process never produced one
    private final String stderrTail;

    public EncodeProcessException(String message) {
        super(message);
        this.exitCode = null;
        this.stderrTail = null;
    }

    public EncodeProcessException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
        this.stderrTail = null;
    }

    public EncodeProcessException(String message, int exitCode, String stderrTail) {
        super(message);
        this.exitCode = exitCode;
        this.stderrTail = stderrTail;
    }

    protected EncodeProcessException(String message, Integer exitCode, String stderrTail, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.stderrTail = stderrTail;
    }

    /**
     * @return The exit code of the encoder, or null if not available.
     */
    public Integer getExitCode() {
        return exitCode;
    }

    /**
     * @return The last lines the encoder wrote to stderr, or null if nothing was captured.
     */
    public String getStderrTail() {
        return stderrTail;
    }

    /**
     * Message followed by the stderr tail, as stored on the failed job.
     */
    public String toDiagnostic() {
        if (stderrTail == null || stderrTail.isBlank()) {
            return getMessage();
        }
        return getMessage() + "\n" + stderrTail;
    }
}
