package com.example.renditions.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EncodeProcessException Tests")
class EncodeProcessExceptionTest {

    @Test
    @DisplayName("✅ Exit code and stderr tail are kept and appended to the diagnostic")
    void exitCodeAndTail() {
        EncodeProcessException e = new EncodeProcessException("Encoder exited with code 1", 1,
                "Invalid data found when processing input");

        assertThat(e.getExitCode()).isEqualTo(1);
        assertThat(e.getStderrTail()).isEqualTo("Invalid data found when processing input");
        assertThat(e.toDiagnostic())
                .isEqualTo("Encoder exited with code 1\nInvalid data found when processing input");
    }

    @Test
    @DisplayName("✅ Without a tail the diagnostic is the message")
    void withoutTail() {
        IOException cause = new IOException("No such file");
        EncodeProcessException e = new EncodeProcessException("Could not start ffmpeg", cause);

        assertThat(e.getExitCode()).isNull();
        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.toDiagnostic()).isEqualTo("Could not start ffmpeg");
    }

    @Test
    @DisplayName("✅ Timeout is an EncodeProcessException naming the limit")
    void timeout() {
        EncodeTimeoutException e = new EncodeTimeoutException(Duration.ofSeconds(90), "frame=100");

        assertThat(e).isInstanceOf(EncodeProcessException.class);
        assertThat(e.getLimit()).isEqualTo(Duration.ofSeconds(90));
        assertThat(e.getExitCode()).isNull();
        assertThat(e.getMessage()).contains("90s");
        assertThat(e.toDiagnostic()).endsWith("frame=100");
    }
}
