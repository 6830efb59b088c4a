package com.example.renditions.exceptions;

import java.time.Duration;

public class EncodeTimeoutException extends EncodeProcessException {

    private final Duration limit;

    public EncodeTimeoutException(Duration limit, String stderrTail) {
        super("Encode exceeded the maximum duration of " + limit.toSeconds() + "s and was terminated",
                null, stderrTail, null);
        this.limit = limit;
    }

    public Duration getLimit() {
        return limit;
    }
}
