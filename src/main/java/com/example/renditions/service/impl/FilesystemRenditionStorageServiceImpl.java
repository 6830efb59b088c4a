package com.example.renditions.service.impl;

import com.example.renditions.domain.RenditionKey;
import com.example.renditions.exceptions.RenditionStorageException;
import com.example.renditions.service.RenditionStorageService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class FilesystemRenditionStorageServiceImpl implements RenditionStorageService {

    private static final Logger log = LoggerFactory.getLogger(FilesystemRenditionStorageServiceImpl.class);
    private static final String RENDITION_EXTENSION = ".mp4";
    private static final String TEMP_SUFFIX = ".part" + RENDITION_EXTENSION;

    private final Path cacheLocation;
    private final Path temporaryLocation;

    public FilesystemRenditionStorageServiceImpl(
            @Value("${transcode.storage.cache.path}") String cachePath,
            @Value("${transcode.storage.temp.path}") String tempPath) {
        this.cacheLocation = validateStoragePath(cachePath, "Rendition cache");
        this.temporaryLocation = validateStoragePath(tempPath, "Temporary transcode");
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(cacheLocation);
            Files.createDirectories(temporaryLocation);
            log.info("Rendition cache directory initialized at: {}", cacheLocation);
            log.info("Temporary transcode directory initialized at: {}", temporaryLocation);
        } catch (IOException e) {
            throw new RenditionStorageException("Could not initialize storage directories", e);
        }
    }

    @Override
    public Path temporaryOutputPath(String jobId) throws RenditionStorageException {
        if (jobId == null || jobId.isBlank() || !jobId.matches("[A-Za-z0-9-]+")) {
            throw new RenditionStorageException("Invalid job id for temporary output: " + jobId);
        }
        return requireWithin(temporaryLocation.resolve(jobId + TEMP_SUFFIX), temporaryLocation);
    }

    @Override
    public Path renditionPath(RenditionKey key) throws RenditionStorageException {
        Path mediaDirectory = cacheLocation.resolve(safeSegment(key.mediaId()));
        return requireWithin(mediaDirectory.resolve(key.tier().label() + RENDITION_EXTENSION), cacheLocation);
    }

    @Override
    public long publish(Path temporaryOutput, Path finalPath) throws RenditionStorageException {
        Path source = requireWithin(temporaryOutput, temporaryLocation);
        Path target = requireWithin(finalPath, cacheLocation);
        try {
            if (!Files.isRegularFile(source) || Files.size(source) == 0) {
                throw new RenditionStorageException("Encoder output is missing or empty: " + source);
            }
            Files.createDirectories(target.getParent());
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                // Different file systems: copy next to the target first, then rename within the target directory
                Path staging = target.resolveSibling(".staging-" + UUID.randomUUID() + RENDITION_EXTENSION);
                log.debug("Atomic move across file systems not supported, staging through {}", staging);
                try {
                    Files.copy(source, staging, StandardCopyOption.REPLACE_EXISTING);
                    Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                    Files.deleteIfExists(source);
                } finally {
                    Files.deleteIfExists(staging);
                }
            }
            long size = Files.size(target);
            log.debug("Published rendition {} ({} bytes)", target, size);
            return size;
        } catch (IOException e) {
            throw new RenditionStorageException("Failed to publish " + source + " to " + target, e);
        }
    }

    @Override
    public boolean exists(Path renditionPath) {
        return renditionPath != null && Files.isRegularFile(renditionPath);
    }

    @Override
    public boolean delete(Path path) throws RenditionStorageException {
        if (path == null) {
            throw new RenditionStorageException("Path to delete cannot be null.");
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(cacheLocation) && !normalized.startsWith(temporaryLocation)) {
            throw new RenditionStorageException(
                    "Security check failed: Cannot delete file outside managed directories: " + path);
        }
        try {
            boolean deleted = Files.deleteIfExists(normalized);
            if (deleted) {
                log.debug("Deleted file: {}", normalized);
            } else {
                log.debug("File already absent, nothing to delete: {}", normalized);
            }
            return deleted;
        } catch (IOException e) {
            throw new RenditionStorageException("Failed to delete file due to IO error: " + normalized, e);
        }
    }

    @Override
    public int clearTemporaryOutputs() {
        int removed = 0;
        try (Stream<Path> leftovers = Files.list(temporaryLocation)) {
            for (Path leftover : leftovers.filter(Files::isRegularFile).toList()) {
                try {
                    Files.deleteIfExists(leftover);
                    removed++;
                } catch (IOException e) {
                    log.warn("Failed to remove leftover temporary file {}: {}", leftover, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Could not list temporary directory {}: {}", temporaryLocation, e.getMessage());
        }
        if (removed > 0) {
            log.info("Removed {} leftover temporary transcode files", removed);
        }
        return removed;
    }

    // Helper methods

    /**
     * Maps an opaque media id to a single safe directory name.
     */
    static String safeSegment(String mediaId) {
        if (mediaId == null || mediaId.isBlank()) {
            throw new RenditionStorageException("Media id cannot be null or blank.");
        }
        String sanitized = mediaId.replaceAll("[^A-Za-z0-9._-]", "_");
        if (sanitized.chars().allMatch(c -> c == '.')) {
            sanitized = "_" + sanitized;
        }
        if (!sanitized.equals(mediaId)) {
            // Keep distinct ids distinct after sanitizing
            sanitized = sanitized + "-" + Integer.toHexString(mediaId.hashCode());
        }
        return sanitized;
    }

    private static Path requireWithin(Path path, Path root) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new RenditionStorageException("Security Error: Path is outside " + root + ": " + path);
        }
        return normalized;
    }

    private static Path validateStoragePath(String pathString, String purpose) {
        if (pathString == null || pathString.isBlank()) {
            throw new IllegalArgumentException(purpose + " path cannot be blank in configuration.");
        }
        if (pathString.contains("..")) {
            throw new IllegalArgumentException(purpose + " path configuration contains traversal patterns ('..'): " + pathString);
        }
        try {
            return Paths.get(pathString).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path format configured for " + purpose + ": " + pathString, e);
        }
    }
}
