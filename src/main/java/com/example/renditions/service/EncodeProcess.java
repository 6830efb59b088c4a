package com.example.renditions.service;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Handle on a running encode, used by the worker's monitoring loop.
 */
public interface EncodeProcess extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the process to exit.
     *
     * @return true if the process has exited.
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /**
     * Exit code; only meaningful once {@link #waitFor} returned true.
     */
    int exitCode();

    /**
     * Media time already encoded, as reported by the encoder, if it reports it.
     */
    OptionalDouble encodedSeconds();

    /**
     * Last lines of the encoder's error stream.
     */
    String stderrTail();

    /**
     * Forcibly terminates the process.
     */
    void destroy();

    /**
     * Releases resources held for the process (log files). Does not touch the output file.
     */
    @Override
    void close();
}
