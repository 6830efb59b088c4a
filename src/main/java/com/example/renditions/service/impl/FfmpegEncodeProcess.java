package com.example.renditions.service.impl;

import com.example.renditions.service.EncodeProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A running ffmpeg process whose error stream is redirected to a log file.
 */
class FfmpegEncodeProcess implements EncodeProcess {

    private static final Logger log = LoggerFactory.getLogger(FfmpegEncodeProcess.class);

    static final int TAIL_BYTES = 8192;
    static final int TAIL_LINES = 10;
    private static final Pattern TIME_PATTERN = Pattern.compile("time=(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

    private final Process process;
    private final Path stderrLog;

    FfmpegEncodeProcess(Process process, Path stderrLog) {
        this.process = process;
        this.stderrLog = stderrLog;
    }

    @Override
    public boolean waitFor(Duration timeout) throws InterruptedException {
        return process.waitFor(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public int exitCode() {
        return process.exitValue();
    }

    @Override
    public OptionalDouble encodedSeconds() {
        return parseEncodedSeconds(readTail());
    }

    @Override
    public String stderrTail() {
        List<String> lines = new ArrayList<>();
        for (String line : readTail().split("[\\r\\n]+")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        int from = Math.max(0, lines.size() - TAIL_LINES);
        return String.join("\n", lines.subList(from, lines.size()));
    }

    @Override
    public void destroy() {
        if (process.isAlive()) {
            log.warn("Forcibly terminating ffmpeg process {}", process.pid());
            process.destroyForcibly();
        }
    }

    @Override
    public void close() {
        destroy();
        try {
            Files.deleteIfExists(stderrLog);
        } catch (IOException e) {
            log.warn("Could not delete encoder log {}: {}", stderrLog, e.getMessage());
        }
    }

    /**
     * Last {@code time=HH:MM:SS.xx} position reported in the given ffmpeg output.
     */
    static OptionalDouble parseEncodedSeconds(String output) {
        Matcher matcher = TIME_PATTERN.matcher(output);
        OptionalDouble last = OptionalDouble.empty();
        while (matcher.find()) {
            double seconds = Integer.parseInt(matcher.group(1)) * 3600.0
                    + Integer.parseInt(matcher.group(2)) * 60.0
                    + Double.parseDouble(matcher.group(3));
            last = OptionalDouble.of(seconds);
        }
        return last;
    }

    private String readTail() {
        if (!Files.isRegularFile(stderrLog)) {
            return "";
        }
        try (RandomAccessFile file = new RandomAccessFile(stderrLog.toFile(), "r")) {
            long length = file.length();
            int size = (int) Math.min(TAIL_BYTES, length);
            byte[] buffer = new byte[size];
            file.seek(length - size);
            file.readFully(buffer);
            return new String(buffer, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read encoder log {}: {}", stderrLog, e.getMessage());
            return "";
        }
    }
}
