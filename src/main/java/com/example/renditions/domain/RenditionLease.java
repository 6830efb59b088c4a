package com.example.renditions.domain;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pins a cached rendition while a caller reads it. Eviction skips pinned renditions
 * until every lease on them has been closed. Closing more than once has no effect.
 */
public final class RenditionLease implements AutoCloseable {

    private final RenditionKey key;
    private final Path path;
    private final long fileSize;
    private final Runnable onRelease;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RenditionLease(RenditionKey key, Path path, long fileSize, Runnable onRelease) {
        this.key = key;
        this.path = path;
        this.fileSize = fileSize;
        this.onRelease = onRelease;
    }

    public RenditionKey key() {
        return key;
    }

    public Path path() {
        return path;
    }

    public long fileSize() {
        return fileSize;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}
