package com.example.renditions.service;

import com.example.renditions.domain.SourceProperties;
import com.example.renditions.exceptions.SourceProbeException;

import java.nio.file.Path;

public interface MediaProbeService {

    /**
     * Extracts duration, dimensions, codecs and bitrate from a media file.
     *
     * @param mediaPath The file to inspect.
     * @return The probed properties.
     * @throws SourceProbeException if the prober is unavailable or cannot read the file.
     */
    SourceProperties probe(Path mediaPath) throws SourceProbeException;
}
