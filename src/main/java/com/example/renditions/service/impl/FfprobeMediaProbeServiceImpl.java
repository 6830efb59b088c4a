package com.example.renditions.service.impl;

import com.example.renditions.domain.SourceProperties;
import com.example.renditions.exceptions.SourceProbeException;
import com.example.renditions.service.MediaProbeService;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.probe.FFmpegFormat;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Service
public class FfprobeMediaProbeServiceImpl implements MediaProbeService {

    private static final Logger log = LoggerFactory.getLogger(FfprobeMediaProbeServiceImpl.class);

    private final FFprobe ffprobe;

    public FfprobeMediaProbeServiceImpl(@Autowired(required = false) FFprobe ffprobe) {
        this.ffprobe = ffprobe;
    }

    @Override
    public SourceProperties probe(Path mediaPath) throws SourceProbeException {
        if (ffprobe == null) {
            throw new SourceProbeException("FFprobe is not configured; cannot probe " + mediaPath);
        }
        if (mediaPath == null || !Files.isRegularFile(mediaPath)) {
            throw new SourceProbeException("Media file does not exist: " + mediaPath);
        }

        FFmpegProbeResult result;
        try {
            log.debug("Probing media file: {}", mediaPath);
            result = ffprobe.probe(mediaPath.toString());
        } catch (IOException e) {
            throw new SourceProbeException("FFprobe failed for " + mediaPath + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // The wrapper reports unparseable output as unchecked exceptions
            throw new SourceProbeException("Unexpected FFprobe error for " + mediaPath + ": " + e.getMessage(), e);
        }
        if (result == null) {
            throw new SourceProbeException("FFprobe returned no result for " + mediaPath);
        }

        FFmpegStream video = firstStream(result.getStreams(), "video");
        FFmpegStream audio = firstStream(result.getStreams(), "audio");
        FFmpegFormat format = result.getFormat();

        SourceProperties properties = new SourceProperties(
                format != null ? Math.max(0, format.duration) : 0,
                video != null ? video.width : 0,
                video != null ? video.height : 0,
                video != null && video.codec_name != null ? video.codec_name : "",
                audio != null && audio.codec_name != null ? audio.codec_name : "",
                format != null ? Math.max(0, format.bit_rate) : 0
        );
        log.debug("Probed {}: {}x{}, {}s, video={}, audio={}", mediaPath, properties.width(), properties.height(),
                properties.durationSeconds(), properties.videoCodec(), properties.audioCodec());
        return properties;
    }

    private static FFmpegStream firstStream(List<FFmpegStream> streams, String codecType) {
        if (streams == null) {
            return null;
        }
        for (FFmpegStream stream : streams) {
            if (stream != null && stream.codec_type != null
                    && codecType.equalsIgnoreCase(String.valueOf(stream.codec_type))) {
                return stream;
            }
        }
        return null;
    }
}
