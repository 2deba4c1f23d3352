package com.example.creatorclaims.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Current ownership state of one video fingerprint. One row per fingerprint, never deleted.
 */
@Entity
@Table(name = "video_ownership_claims",
        indexes = {
                @Index(name = "idx_ownership_claim_status", columnList = "status")
        })
public class OwnershipClaim {

    @Id
    @Column(name = "video_fingerprint", length = 255)
    private String videoFingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column
    private Long currentOwnerAssetId;

    @Column
    private Long currentOwnerUserId;

    @Column
    private Long currentOwnerSocialAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClaimStatus status = ClaimStatus.UNCLAIMED;

    @Column(nullable = false)
    private int contestedCount = 0;

    @Column
    private Instant lastContestedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column
    private Instant updatedAt;

    // Null until first persisted, which is how Spring Data tells new rows from existing ones
    @Version
    private Long version;

    public enum ClaimStatus {
        UNCLAIMED,
        PENDING,
        CLAIMED,
        CONTESTED
    }

    public OwnershipClaim() {
    }

    public OwnershipClaim(String videoFingerprint, Platform platform) {
        this.videoFingerprint = videoFingerprint;
        this.platform = platform;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    public void assignOwner(Long assetId, Long userId, Long socialAccountId) {
        this.currentOwnerAssetId = assetId;
        this.currentOwnerUserId = userId;
        this.currentOwnerSocialAccountId = socialAccountId;
    }

    public void recordContest(Instant at) {
        this.contestedCount++;
        this.lastContestedAt = at;
    }

    public String getVideoFingerprint() {
        return videoFingerprint;
    }

    public Platform getPlatform() {
        return platform;
    }

    public Long getCurrentOwnerAssetId() {
        return currentOwnerAssetId;
    }

    public Long getCurrentOwnerUserId() {
        return currentOwnerUserId;
    }

    public Long getCurrentOwnerSocialAccountId() {
        return currentOwnerSocialAccountId;
    }

    public ClaimStatus getStatus() {
        return status;
    }

    public void setStatus(ClaimStatus status) {
        this.status = status;
    }

    public int getContestedCount() {
        return contestedCount;
    }

    public Instant getLastContestedAt() {
        return lastContestedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}
