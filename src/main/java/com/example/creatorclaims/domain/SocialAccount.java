package com.example.creatorclaims.domain;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "social_accounts",
        indexes = {
                @Index(name = "idx_social_account_user", columnList = "userId"),
                @Index(name = "idx_social_account_snapshot", columnList = "snapshotId"),
                @Index(name = "idx_social_account_pending", columnList = "webhookStatus,verificationStatus")
        })
public class SocialAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private Platform platform;

    @Column(nullable = false, length = 512)
    private String profileUrl;

    @Column(length = 255)
    private String username;

    @Column(unique = true, length = 32)
    private String verificationCode;

    // Correlation id of the provider job currently in flight (nullable)
    @Column(length = 128)
    private String snapshotId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private WebhookStatus webhookStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VerificationStatus verificationStatus = VerificationStatus.UNVERIFIED;

    @Column(nullable = false)
    private int verificationAttempts = 0;

    // Last payload fetched from the provider, raw JSON
    @Column(columnDefinition = "TEXT")
    private String profileData;

    @Column
    private Instant lastVerificationAttemptAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column
    private Instant updatedAt;

    public enum VerificationStatus {
        UNVERIFIED, // Linked, no job requested yet
        PENDING,    // Job requested, waiting for a result
        VERIFIED,   // Code found in bio
        FAILED      // Code absent or provider job failed
    }

    public enum WebhookStatus {
        PENDING,
        COMPLETED,
        FAILED
    }

    public SocialAccount() {
    }

    public SocialAccount(Long userId, Platform platform, String profileUrl, String username, String verificationCode) {
        this.userId = userId;
        this.platform = platform;
        this.profileUrl = profileUrl;
        this.username = username;
        this.verificationCode = verificationCode;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    /**
     * Moves the account into PENDING for a freshly triggered provider job.
     * A retry out of FAILED also drops the previous payload so it cannot satisfy the new check.
     *
     * @param newSnapshotId the provider's correlation id for the new job
     */
    public void beginVerification(String newSnapshotId) {
        if (this.verificationStatus == VerificationStatus.FAILED) {
            this.profileData = null;
        }
        this.snapshotId = newSnapshotId;
        this.webhookStatus = WebhookStatus.PENDING;
        this.verificationStatus = VerificationStatus.PENDING;
        this.lastVerificationAttemptAt = Instant.now();
    }

    public boolean isAwaitingResult() {
        return verificationStatus == VerificationStatus.PENDING
                && webhookStatus == WebhookStatus.PENDING
                && snapshotId != null;
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

    public Platform getPlatform() {
        return platform;
    }

    public String getProfileUrl() {
        return profileUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getVerificationCode() {
        return verificationCode;
    }

    public void setVerificationCode(String verificationCode) {
        this.verificationCode = verificationCode;
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public void setSnapshotId(String snapshotId) {
        this.snapshotId = snapshotId;
    }

    public WebhookStatus getWebhookStatus() {
        return webhookStatus;
    }

    public void setWebhookStatus(WebhookStatus webhookStatus) {
        this.webhookStatus = webhookStatus;
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public void setVerificationStatus(VerificationStatus verificationStatus) {
        this.verificationStatus = verificationStatus;
    }

    public int getVerificationAttempts() {
        return verificationAttempts;
    }

    public void setVerificationAttempts(int verificationAttempts) {
        this.verificationAttempts = verificationAttempts;
    }

    public String getProfileData() {
        return profileData;
    }

    public void setProfileData(String profileData) {
        this.profileData = profileData;
    }

    public Instant getLastVerificationAttemptAt() {
        return lastVerificationAttemptAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "SocialAccount{id=" + id + ", platform=" + platform + ", username='" + username
                + "', verificationStatus=" + verificationStatus + ", webhookStatus=" + webhookStatus
                + ", snapshotId='" + snapshotId + "'}";
    }
}
