package com.example.creatorclaims.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Contest entry owned by the contest module. Only the ownership columns are written here.
 */
@Entity
@Table(name = "contest_submissions",
        indexes = {
                @Index(name = "idx_contest_submission_user", columnList = "userId"),
                @Index(name = "idx_contest_submission_raw_asset", columnList = "rawVideoAssetId"),
                @Index(name = "idx_contest_submission_mp4_status", columnList = "mp4OwnershipStatus")
        })
public class ContestSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long contestId;

    @Column(nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Platform platform;

    @Column(nullable = false, length = 1024)
    private String originalVideoUrl;

    @Column
    private Long socialAccountId;

    @Column
    private Long rawVideoAssetId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Mp4OwnershipStatus mp4OwnershipStatus = Mp4OwnershipStatus.PENDING;

    @Column
    private Long mp4OwnerSocialAccountId;

    @Column(length = 512)
    private String mp4OwnershipReason;

    @Column(nullable = false)
    private boolean disqualified = false;

    @Column
    private Instant ownershipResolvedAt;

    @Version
    private Long version;

    public enum Mp4OwnershipStatus {
        PENDING,
        VERIFIED,
        FAILED,
        CONTESTED,
        NOT_UPLOADED
    }

    public ContestSubmission() {
    }

    public ContestSubmission(Long contestId, Long userId, Platform platform, String originalVideoUrl) {
        this.contestId = contestId;
        this.userId = userId;
        this.platform = platform;
        this.originalVideoUrl = originalVideoUrl;
    }

    /**
     * Links the uploaded MP4 and mirrors its initial ownership status.
     */
    public void attachRawVideo(Long assetId, RawVideoAsset.OwnershipStatus assetStatus, Long ownerSocialAccountId) {
        this.rawVideoAssetId = assetId;
        switch (assetStatus) {
            case PENDING -> this.mp4OwnershipStatus = Mp4OwnershipStatus.PENDING;
            case VERIFIED -> {
                this.mp4OwnershipStatus = Mp4OwnershipStatus.VERIFIED;
                this.mp4OwnerSocialAccountId = ownerSocialAccountId;
                this.ownershipResolvedAt = Instant.now();
            }
            case CONTESTED -> this.mp4OwnershipStatus = Mp4OwnershipStatus.CONTESTED;
            case FAILED -> this.mp4OwnershipStatus = Mp4OwnershipStatus.FAILED;
            case NOT_REQUIRED -> {
                // ownership is not tracked for this entry
            }
        }
        if (ownerSocialAccountId != null && this.socialAccountId == null) {
            this.socialAccountId = ownerSocialAccountId;
        }
    }

    public void markOwnershipVerified(Long socialAccountId, String reason, Instant at) {
        this.mp4OwnershipStatus = Mp4OwnershipStatus.VERIFIED;
        this.mp4OwnerSocialAccountId = socialAccountId;
        this.mp4OwnershipReason = reason;
        this.ownershipResolvedAt = at;
    }

    public void disqualify(String reason, Instant at) {
        this.mp4OwnershipStatus = Mp4OwnershipStatus.FAILED;
        this.mp4OwnershipReason = reason;
        this.disqualified = true;
        this.ownershipResolvedAt = at;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getContestId() {
        return contestId;
    }

    public Long getUserId() {
        return userId;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getOriginalVideoUrl() {
        return originalVideoUrl;
    }

    public Long getSocialAccountId() {
        return socialAccountId;
    }

    public void setSocialAccountId(Long socialAccountId) {
        this.socialAccountId = socialAccountId;
    }

    public Long getRawVideoAssetId() {
        return rawVideoAssetId;
    }

    public void setRawVideoAssetId(Long rawVideoAssetId) {
        this.rawVideoAssetId = rawVideoAssetId;
    }

    public Mp4OwnershipStatus getMp4OwnershipStatus() {
        return mp4OwnershipStatus;
    }

    public Long getMp4OwnerSocialAccountId() {
        return mp4OwnerSocialAccountId;
    }

    public String getMp4OwnershipReason() {
        return mp4OwnershipReason;
    }

    public void setMp4OwnershipReason(String mp4OwnershipReason) {
        this.mp4OwnershipReason = mp4OwnershipReason;
    }

    public boolean isDisqualified() {
        return disqualified;
    }

    public Instant getOwnershipResolvedAt() {
        return ownershipResolvedAt;
    }
}
