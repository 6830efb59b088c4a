package com.example.renditions.service.impl;

import com.example.renditions.domain.QualityTier;
import com.example.renditions.exceptions.EncodeProcessException;
import com.example.renditions.service.EncodeProcess;
import com.example.renditions.service.EncodeRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FfmpegMediaEncoder Implementation Tests")
class FfmpegMediaEncoderImplTest {

    @TempDir
    Path tempDir;

    private EncodeRequest request;

    @BeforeEach
    void setUp() {
        request = EncodeRequest.forTier("job-1", tempDir.resolve("in.mkv"), tempDir.resolve("job-1.part.mp4"),
                QualityTier.P720);
    }

    private FfmpegMediaEncoderImpl encoder(String ffmpegPath) {
        return new FfmpegMediaEncoderImpl(ffmpegPath, "libx264", "aac", "fast", false, tempDir.toString());
    }

    @Test
    @DisplayName("✅ buildCommand: Renders the tier's fixed encode parameters")
    void buildCommand_TierParameters() {
        List<String> command = encoder("/opt/ffmpeg/bin/ffmpeg").buildCommand(request);

        assertThat(command.get(0)).isEqualTo("/opt/ffmpeg/bin/ffmpeg");
        assertThat(command).containsSubsequence("-i", request.inputPath().toString());
        assertThat(command).containsSubsequence("-vcodec", "libx264");
        assertThat(command).containsSubsequence("-acodec", "aac");
        assertThat(command).containsSubsequence("-s", "1280x720");
        assertThat(command).contains("-crf");
        assertThat(command).containsSubsequence("-preset", "fast");
        assertThat(command).containsSubsequence("-movflags", "+faststart");
        assertThat(command).contains("-y");
        assertThat(command.get(command.size() - 1)).isEqualTo(request.outputPath().toString());
    }

    @Test
    @DisplayName("❌ Constructor: Blank ffmpeg path is rejected")
    void constructor_BlankPath() {
        assertThatThrownBy(() -> encoder(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("❌ start: Missing binary raises EncodeProcessException")
    void start_MissingBinary() {
        FfmpegMediaEncoderImpl encoder = encoder(tempDir.resolve("no-such-ffmpeg").toString());

        assertThatThrownBy(() -> encoder.start(request))
                .isInstanceOf(EncodeProcessException.class)
                .hasMessageContaining("Could not start ffmpeg");
    }

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Against a scripted ffmpeg stand-in")
    class ScriptedBinary {

        private Path script(String body) throws IOException {
            Path script = tempDir.resolve("ffmpeg-" + System.nanoTime() + ".sh");
            Files.writeString(script, "#!/bin/sh\nfor last; do :; done\n" + body + "\n");
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
            return script;
        }

        @Test
        @DisplayName("✅ Successful run writes the output and reports progress from stderr")
        void success() throws Exception {
            Path ffmpeg = script("""
                    echo "frame=  48 fps=0.0 q=28.0 size=0kB time=00:00:02.00 bitrate=N/A" >&2
                    echo "frame=  96 fps=48 q=28.0 size=64kB time=00:00:04.50 bitrate=116.5kbits/s" >&2
                    printf 'rendition' > "$last"
                    exit 0""");

            try (EncodeProcess process = encoder(ffmpeg.toString()).start(request)) {
                assertThat(process.waitFor(Duration.ofSeconds(10))).isTrue();
                assertThat(process.exitCode()).isZero();
                assertThat(process.encodedSeconds()).hasValue(4.5);
            }
            assertThat(request.outputPath()).hasContent("rendition");
            assertThat(tempDir.resolve("job-1.log")).doesNotExist();
        }

        @Test
        @DisplayName("❌ Non-zero exit exposes the exit code and the stderr tail")
        void failure() throws Exception {
            Path ffmpeg = script("""
                    i=0
                    while [ $i -lt 20 ]; do echo "noise line $i" >&2; i=$((i+1)); done
                    echo "in.mkv: Invalid data found when processing input" >&2
                    exit 1""");

            try (EncodeProcess process = encoder(ffmpeg.toString()).start(request)) {
                assertThat(process.waitFor(Duration.ofSeconds(10))).isTrue();
                assertThat(process.exitCode()).isEqualTo(1);
                String tail = process.stderrTail();
                assertThat(tail).endsWith("in.mkv: Invalid data found when processing input");
                assertThat(tail.split("\n")).hasSize(FfmpegEncodeProcess.TAIL_LINES);
                assertThat(tail).doesNotContain("noise line 0");
            }
        }

        @Test
        @DisplayName("⚠️ destroy kills a hanging encoder")
        void destroy() throws Exception {
            Path ffmpeg = script("exec sleep 30");

            try (EncodeProcess process = encoder(ffmpeg.toString()).start(request)) {
                assertThat(process.waitFor(Duration.ofMillis(200))).isFalse();
                process.destroy();
                assertThat(process.waitFor(Duration.ofSeconds(10))).isTrue();
            }
        }
    }
}
