package com.example.renditions.service.impl;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Advisory progress for a running encode. Uses the encoder's reported position when the source
 * duration is known, otherwise an elapsed-time curve that approaches but never reaches 99.
 * Results never decrease.
 */
final class ProgressEstimator {

    static final int MAX_RUNNING_PROGRESS = 99;

    private final double sourceDurationSeconds;
    private final double halfLifeSeconds;
    private int last;

    /**
     * @param sourceDurationSeconds Source duration, or 0 when unknown.
     * @param halfLife              Elapsed time at which the time-based estimate reaches 50%.
     */
    ProgressEstimator(double sourceDurationSeconds, Duration halfLife) {
        this.sourceDurationSeconds = Math.max(0, sourceDurationSeconds);
        this.halfLifeSeconds = Math.max(1, halfLife.toMillis() / 1000.0);
    }

    int estimate(Duration elapsed, OptionalDouble encodedSeconds) {
        double fraction;
        if (sourceDurationSeconds > 0 && encodedSeconds.isPresent()) {
            fraction = encodedSeconds.getAsDouble() / sourceDurationSeconds;
        } else {
            double seconds = elapsed.toMillis() / 1000.0;
            fraction = seconds / (seconds + halfLifeSeconds);
        }
        int percent = (int) Math.floor(Math.max(0, fraction) * 100);
        last = Math.max(last, Math.min(MAX_RUNNING_PROGRESS, percent));
        return last;
    }
}
