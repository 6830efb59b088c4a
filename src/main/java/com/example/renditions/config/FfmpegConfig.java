package com.example.renditions.config;

import com.example.renditions.exceptions.EncoderInitializationException;
import net.bramp.ffmpeg.FFprobe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class FfmpegConfig {

    private static final Logger log = LoggerFactory.getLogger(FfmpegConfig.class);

    @Value("${ffprobe.path:ffprobe}")
    private String ffprobePath;

    /**
     * Probe collaborator. Without a configured path no bean is created and every probe
     * degrades to the requested-quality fallback.
     */
    @Bean
    public FFprobe fFprobe() {
        if (ffprobePath == null || ffprobePath.isBlank()) {
            log.warn("ffprobe.path is not configured. Source probing is disabled; quality negotiation will fall back to the requested tier.");
            return null;
        }
        try {
            log.info("Creating FFprobe bean with path: {}", ffprobePath);
            return new FFprobe(ffprobePath);
        } catch (IOException e) {
            throw new EncoderInitializationException("Failed to initialize FFprobe with path: " + ffprobePath, e);
        } catch (IllegalArgumentException e) {
            throw new EncoderInitializationException("Invalid configuration for FFprobe path: " + ffprobePath, e);
        }
    }
}
