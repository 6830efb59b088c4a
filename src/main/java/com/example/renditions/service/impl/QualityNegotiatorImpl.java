package com.example.renditions.service.impl;

import com.example.renditions.domain.MediaSource;
import com.example.renditions.domain.QualityResolution;
import com.example.renditions.domain.QualityTier;
import com.example.renditions.domain.SourceProperties;
import com.example.renditions.exceptions.SourceProbeException;
import com.example.renditions.service.MediaProbeService;
import com.example.renditions.service.QualityNegotiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

@Service
public class QualityNegotiatorImpl implements QualityNegotiator {

    private static final Logger log = LoggerFactory.getLogger(QualityNegotiatorImpl.class);

    private final MediaProbeService mediaProbeService;

    public QualityNegotiatorImpl(MediaProbeService mediaProbeService) {
        this.mediaProbeService = mediaProbeService;
    }

    @Override
    public QualityResolution resolve(String mediaId, Path inputPath, QualityTier requested) {
        MediaSource source;
        try {
            SourceProperties properties = mediaProbeService.probe(inputPath);
            source = new MediaSource(mediaId, inputPath, properties);
        } catch (SourceProbeException e) {
            log.warn("Probe failed for media {} ({}). Falling back to requested quality {}. Reason: {}",
                    mediaId, inputPath, requested, e.getMessage());
            source = MediaSource.unprobed(mediaId, inputPath);
        }

        QualityTier resolved = negotiate(source, requested);
        if (resolved != requested) {
            log.info("Resolved quality for media {} from requested {} down to {} (source capability)",
                    mediaId, requested, resolved);
        } else {
            log.debug("Resolved quality for media {}: {}", mediaId, resolved);
        }
        return new QualityResolution(source, requested, resolved);
    }

    @Override
    public QualityTier negotiate(MediaSource source, QualityTier requested) {
        Optional<QualityTier> capability = source.capabilityTier();
        return capability
                .map(tier -> QualityTier.lower(requested, tier))
                .orElse(requested);
    }
}
