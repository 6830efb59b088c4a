package com.example.renditions.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "cached_renditions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_rendition_media_quality", columnNames = {"mediaId", "qualityTier"})
        },
        indexes = {
                @Index(name = "idx_rendition_media", columnList = "mediaId"),
                @Index(name = "idx_rendition_last_accessed", columnList = "lastAccessedAt")
        })
public class CachedRendition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String mediaId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private QualityTier qualityTier;

    @Column(nullable = false, length = 1024)
    private String outputPath;

    @Column(nullable = false)
    private long fileSize; // bytes

    @Column
    private Double duration; // seconds, null when unknown

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastAccessedAt;

    protected CachedRendition() {
    }

    public CachedRendition(String mediaId, QualityTier qualityTier, String outputPath, long fileSize, Double duration) {
        this.mediaId = mediaId;
        this.qualityTier = qualityTier;
        this.outputPath = outputPath;
        this.fileSize = fileSize;
        this.duration = duration;
        this.createdAt = Instant.now();
        this.lastAccessedAt = this.createdAt;
    }

    /**
     * Replaces the artifact metadata; the last writer's values stand.
     */
    public void replaceArtifact(String outputPath, long fileSize, Double duration) {
        this.outputPath = outputPath;
        this.fileSize = fileSize;
        this.duration = duration;
        this.createdAt = Instant.now();
        this.lastAccessedAt = this.createdAt;
    }

    public void touch() {
        this.lastAccessedAt = Instant.now();
    }

    public boolean isStale(Instant cutoff) {
        return lastAccessedAt.isBefore(cutoff);
    }

    public RenditionKey renditionKey() {
        return new RenditionKey(mediaId, qualityTier);
    }

    public Long getId() {
        return id;
    }

    public String getMediaId() {
        return mediaId;
    }

    public QualityTier getQualityTier() {
        return qualityTier;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public long getFileSize() {
        return fileSize;
    }

    public Double getDuration() {
        return duration;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
