package com.example.renditions.service.impl;

import com.example.renditions.domain.RenditionKey;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The set of active (queued or running) jobs, at most one per rendition key.
 * Admission and release of a key are serialized through the key's lock.
 */
@Component
public class ActiveJobRegistry {

    private final Map<RenditionKey, String> activeJobs = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    public <T> T withKeyLock(RenditionKey key, Supplier<T> action) {
        ReentrantLock lock = locks.lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> activeJob(RenditionKey key) {
        return Optional.ofNullable(activeJobs.get(key));
    }

    /**
     * @throws IllegalStateException if another job is already active for the key.
     */
    public void register(RenditionKey key, String jobId) {
        withKeyLock(key, () -> {
            String existing = activeJobs.putIfAbsent(key, jobId);
            if (existing != null && !existing.equals(jobId)) {
                throw new IllegalStateException("Job " + existing + " is already active for " + key);
            }
            return null;
        });
    }

    /**
     * Removes the key's entry if it still belongs to {@code jobId}.
     *
     * @return true if the entry was removed.
     */
    public boolean release(RenditionKey key, String jobId) {
        return withKeyLock(key, () -> activeJobs.remove(key, jobId));
    }

    public int size() {
        return activeJobs.size();
    }
}
