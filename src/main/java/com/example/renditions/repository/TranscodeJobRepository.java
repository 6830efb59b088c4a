package com.example.renditions.repository;

import com.example.renditions.domain.TranscodeJob;
import com.example.renditions.domain.TranscodeJob.JobState;
import org.springframework.data.repository.CrudRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TranscodeJobRepository extends CrudRepository<TranscodeJob, Long> {

    /**
     * Finds a job by the identifier handed out to callers.
     *
     * @param publicId The UUID string returned by submit.
     * @return An Optional containing the job if found.
     */
    Optional<TranscodeJob> findByPublicId(String publicId);

    List<TranscodeJob> findByStatusIn(Collection<JobState> statuses);

    long countByStatus(JobState status);

    /**
     * Deletes terminal jobs that finished before the cutoff.
     *
     * @return The number of rows removed.
     */
    @Transactional
    long deleteByStatusInAndCompletedAtBefore(Collection<JobState> statuses, Instant cutoff);
}
