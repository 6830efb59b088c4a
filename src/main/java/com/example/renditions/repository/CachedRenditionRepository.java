package com.example.renditions.repository;

import com.example.renditions.domain.CachedRendition;
import com.example.renditions.domain.QualityTier;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CachedRenditionRepository extends CrudRepository<CachedRendition, Long> {

    Optional<CachedRendition> findByMediaIdAndQualityTier(String mediaId, QualityTier qualityTier);

    List<CachedRendition> findByMediaId(String mediaId);

    List<CachedRendition> findByLastAccessedAtBefore(Instant cutoff);

    List<CachedRendition> findAllByOrderByLastAccessedAtAsc();

    @Query("SELECT COALESCE(SUM(r.fileSize), 0) FROM CachedRendition r")
    long sumFileSize();
}
