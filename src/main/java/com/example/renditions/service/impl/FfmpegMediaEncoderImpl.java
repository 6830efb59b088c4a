package com.example.renditions.service.impl;

import com.example.renditions.exceptions.EncodeProcessException;
import com.example.renditions.exceptions.EncoderInitializationException;
import com.example.renditions.service.EncodeProcess;
import com.example.renditions.service.EncodeRequest;
import com.example.renditions.service.MediaEncoder;
import jakarta.annotation.PostConstruct;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the ffmpeg binary as an external process. The command line is rendered by
 * {@link FFmpegBuilder}; the process itself is started directly so the worker can
 * poll it, kill it on timeout and read the tail of its error stream.
 */
@Service
public class FfmpegMediaEncoderImpl implements MediaEncoder {

    private static final Logger log = LoggerFactory.getLogger(FfmpegMediaEncoderImpl.class);

    private final String ffmpegPath;
    private final String videoCodec;
    private final String audioCodec;
    private final String preset;
    private final boolean verifyOnStartup;
    private final Path logDirectory;

    public FfmpegMediaEncoderImpl(
            @Value("${ffmpeg.path:ffmpeg}") String ffmpegPath,
            @Value("${transcode.encoder.video-codec:libx264}") String videoCodec,
            @Value("${transcode.encoder.audio-codec:aac}") String audioCodec,
            @Value("${transcode.encoder.preset:fast}") String preset,
            @Value("${ffmpeg.verify-on-startup:true}") boolean verifyOnStartup,
            @Value("${transcode.storage.temp.path}") String tempPath) {
        if (ffmpegPath == null || ffmpegPath.isBlank()) {
            throw new IllegalArgumentException("ffmpeg.path is required but not configured.");
        }
        this.ffmpegPath = ffmpegPath;
        this.videoCodec = videoCodec;
        this.audioCodec = audioCodec;
        this.preset = preset;
        this.verifyOnStartup = verifyOnStartup;
        this.logDirectory = Paths.get(tempPath).toAbsolutePath().normalize();
    }

    @PostConstruct
    private void initialize() {
        if (!verifyOnStartup) {
            log.info("Skipping ffmpeg verification at startup (ffmpeg.path={})", ffmpegPath);
            return;
        }
        try {
            FFmpeg ffmpeg = new FFmpeg(ffmpegPath);
            log.info("Using ffmpeg at {}: {}", ffmpegPath, ffmpeg.version());
        } catch (IOException e) {
            throw new EncoderInitializationException("Failed to initialize FFmpeg with path: " + ffmpegPath, e);
        } catch (IllegalArgumentException e) {
            throw new EncoderInitializationException("Invalid configuration for FFmpeg path: " + ffmpegPath, e);
        }
    }

    @Override
    public EncodeProcess start(EncodeRequest request) throws EncodeProcessException {
        List<String> command = buildCommand(request);
        if (log.isDebugEnabled()) {
            log.debug("[Encoder][Job:{}] Command: {}", request.jobId(), String.join(" ", command));
        }

        Path stderrLog = logDirectory.resolve(request.jobId() + ".log");
        try {
            Files.createDirectories(logDirectory);
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            pb.redirectError(stderrLog.toFile());
            Process process = pb.start();
            log.info("[Encoder][Job:{}] Started ffmpeg (pid {}) for {} -> {}",
                    request.jobId(), process.pid(), request.inputPath(), request.outputPath());
            return new FfmpegEncodeProcess(process, stderrLog);
        } catch (IOException e) {
            deleteQuietly(stderrLog);
            throw new EncodeProcessException("Could not start ffmpeg (" + ffmpegPath + "): " + e.getMessage(), e);
        }
    }

    /**
     * Full command line including the executable.
     */
    List<String> buildCommand(EncodeRequest request) {
        FFmpegBuilder builder = new FFmpegBuilder()
                .setVerbosity(FFmpegBuilder.Verbosity.INFO)
                .overrideOutputFiles(true)
                .addInput(request.inputPath().toString())
                .addOutput(request.outputPath().toString())
                .setFormat("mp4")
                .setVideoCodec(videoCodec)
                .setAudioCodec(audioCodec)
                .setVideoBitRate(request.videoBitrate())
                .setAudioBitRate(request.audioBitrate())
                .setVideoResolution(request.width(), request.height())
                .setConstantRateFactor(request.qualityFactor())
                .setPreset(preset)
                .addExtraArgs("-movflags", "+faststart")
                .done();

        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.addAll(builder.build());
        return command;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete encoder log {}: {}", path, e.getMessage());
        }
    }
}
