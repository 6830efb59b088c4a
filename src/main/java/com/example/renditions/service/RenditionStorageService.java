package com.example.renditions.service;

import com.example.renditions.domain.RenditionKey;
import com.example.renditions.exceptions.RenditionStorageException;

import java.nio.file.Path;

/**
 * File layout of the rendition cache: where temporary encoder outputs are written and
 * where published renditions live.
 */
public interface RenditionStorageService {

    /**
     * Path an encoder should write to for the given job. Never visible as a cached rendition.
     */
    Path temporaryOutputPath(String jobId) throws RenditionStorageException;

    /**
     * Final location of a rendition inside the cache directory.
     */
    Path renditionPath(RenditionKey key) throws RenditionStorageException;

    /**
     * Atomically moves a finished temporary output to its final location, replacing any previous file.
     *
     * @return The size of the published file in bytes.
     * @throws RenditionStorageException if the temporary file is missing or empty, or the move fails.
     */
    long publish(Path temporaryOutput, Path finalPath) throws RenditionStorageException;

    boolean exists(Path renditionPath);

    /**
     * Deletes a published rendition or a temporary output.
     *
     * @return true if a file was deleted, false if it did not exist.
     * @throws RenditionStorageException if the path is outside the managed directories or deletion fails.
     */
    boolean delete(Path path) throws RenditionStorageException;

    /**
     * Removes every leftover file from the temporary directory.
     *
     * @return The number of files removed.
     */
    int clearTemporaryOutputs();
}
