package com.example.creatorclaims.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "raw_video_assets",
        indexes = {
                @Index(name = "idx_raw_video_user", columnList = "userId"),
                @Index(name = "idx_raw_video_fingerprint", columnList = "videoFingerprint"),
                @Index(name = "idx_raw_video_status", columnList = "ownershipStatus"),
                @Index(name = "idx_raw_video_submission", columnList = "contestSubmissionId"),
                @Index(name = "idx_raw_video_storage_path", columnList = "storagePath", unique = true)
        })
public class RawVideoAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private SubmissionType submissionType;

    @Column
    private Long contestSubmissionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Platform platform;

    // Canonical form of the submitted URL (tracking params removed, path kept)
    @Column(nullable = false, length = 1024)
    private String videoUrl;

    // URL exactly as submitted; keeps handle segments the canonical form drops
    @Column(length = 1024, updatable = false)
    private String sourceUrl;

    @Column(nullable = false, length = 255)
    private String videoFingerprint;

    @Column(nullable = false)
    private boolean fingerprintLowConfidence = false;

    @Column(nullable = false, length = 512)
    private String storagePath;

    @Column
    private Long sizeBytes;

    @Column(length = 50)
    private String mimeType;

    @Column(nullable = false)
    private Instant uploadedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OwnershipStatus ownershipStatus = OwnershipStatus.PENDING;

    @Column
    private Long ownerSocialAccountId;

    @Column(length = 512)
    private String ownershipReason;

    @Column
    private Instant ownershipVerifiedAt;

    @Version
    private Long version;

    public enum OwnershipStatus {
        PENDING,
        VERIFIED,
        FAILED,
        CONTESTED,
        NOT_REQUIRED
    }

    public enum SubmissionType {
        CONTEST,
        GENERAL
    }

    public RawVideoAsset() {
    }

    public RawVideoAsset(Long userId, SubmissionType submissionType, Platform platform,
                         String videoUrl, String videoFingerprint, String storagePath,
                         Long sizeBytes, String mimeType) {
        this.userId = userId;
        this.submissionType = submissionType;
        this.platform = platform;
        this.videoUrl = videoUrl;
        this.videoFingerprint = videoFingerprint;
        this.storagePath = storagePath;
        this.sizeBytes = sizeBytes;
        this.mimeType = mimeType;
        this.uploadedAt = Instant.now();
    }

    /**
     * Marks this asset as the proven original for its fingerprint.
     */
    public void markVerified(Long socialAccountId, String reason) {
        if (socialAccountId == null) {
            throw new IllegalArgumentException("A verified asset requires an owner social account");
        }
        this.ownerSocialAccountId = socialAccountId;
        this.ownershipStatus = OwnershipStatus.VERIFIED;
        this.ownershipVerifiedAt = Instant.now();
        this.ownershipReason = reason;
    }

    public void markFailed(String reason) {
        this.ownershipStatus = OwnershipStatus.FAILED;
        this.ownershipReason = reason;
    }

    public boolean isAwaitingOwnership() {
        return ownershipStatus == OwnershipStatus.PENDING || ownershipStatus == OwnershipStatus.CONTESTED;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public SubmissionType getSubmissionType() {
        return submissionType;
    }

    public Long getContestSubmissionId() {
        return contestSubmissionId;
    }

    public void setContestSubmissionId(Long contestSubmissionId) {
        this.contestSubmissionId = contestSubmissionId;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public String getVideoFingerprint() {
        return videoFingerprint;
    }

    public boolean isFingerprintLowConfidence() {
        return fingerprintLowConfidence;
    }

    public void setFingerprintLowConfidence(boolean fingerprintLowConfidence) {
        this.fingerprintLowConfidence = fingerprintLowConfidence;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public String getMimeType() {
        return mimeType;
    }

    public Instant getUploadedAt() {
        return uploadedAt;
    }

    public OwnershipStatus getOwnershipStatus() {
        return ownershipStatus;
    }

    public void setOwnershipStatus(OwnershipStatus ownershipStatus) {
        this.ownershipStatus = ownershipStatus;
    }

    public Long getOwnerSocialAccountId() {
        return ownerSocialAccountId;
    }

    public void setOwnerSocialAccountId(Long ownerSocialAccountId) {
        this.ownerSocialAccountId = ownerSocialAccountId;
    }

    public String getOwnershipReason() {
        return ownershipReason;
    }

    public void setOwnershipReason(String ownershipReason) {
        this.ownershipReason = ownershipReason;
    }

    public Instant getOwnershipVerifiedAt() {
        return ownershipVerifiedAt;
    }

    public void setOwnershipVerifiedAt(Instant ownershipVerifiedAt) {
        this.ownershipVerifiedAt = ownershipVerifiedAt;
    }
}
