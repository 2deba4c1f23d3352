package com.example.creatorclaims.repository;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.domain.SocialAccount.WebhookStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SocialAccountRepository extends CrudRepository<SocialAccount, Long> {

    List<SocialAccount> findByUserIdOrderByCreatedAtAsc(Long userId);

    Optional<SocialAccount> findByIdAndUserId(Long id, Long userId);

    Optional<SocialAccount> findBySnapshotId(String snapshotId);

    Optional<SocialAccount> findByPlatformAndProfileUrl(Platform platform, String profileUrl);

    List<SocialAccount> findByPlatformAndUsernameIgnoreCase(Platform platform, String username);

    boolean existsByVerificationCode(String verificationCode);

    /**
     * Accounts whose provider job is still outstanding, oldest attempt first.
     *
     * @param pageable caps the batch size.
     * @return at most {@code pageable.getPageSize()} accounts.
     */
    default List<SocialAccount> findAwaitingResult(Pageable pageable) {
        return findByVerificationStatusAndWebhookStatusAndSnapshotIdIsNotNullOrderByLastVerificationAttemptAtAsc(
                VerificationStatus.PENDING, WebhookStatus.PENDING, pageable);
    }

    List<SocialAccount> findByVerificationStatusAndWebhookStatusAndSnapshotIdIsNotNullOrderByLastVerificationAttemptAtAsc(
            VerificationStatus verificationStatus, WebhookStatus webhookStatus, Pageable pageable);

    /**
     * Points the account at a freshly triggered provider job, unless it reached VERIFIED in the meantime.
     * Keeps an existing verification code and only fills in {@code verificationCode} when none is stored.
     *
     * @return 1 if the account moved to PENDING on {@code snapshotId}, 0 if it is verified or gone.
     */
    default int startJob(Long id, String snapshotId, String verificationCode, Instant now) {
        return beginJob(id, snapshotId, verificationCode, now,
                VerificationStatus.PENDING, WebhookStatus.PENDING, VerificationStatus.VERIFIED);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SocialAccount a SET a.verificationStatus = :pending, a.webhookStatus = :webhookPending,"
            + " a.snapshotId = :snapshotId, a.profileData = NULL,"
            + " a.verificationCode = COALESCE(a.verificationCode, :code),"
            + " a.lastVerificationAttemptAt = :now, a.updatedAt = :now"
            + " WHERE a.id = :id AND a.verificationStatus <> :verified")
    int beginJob(@Param("id") Long id,
                 @Param("snapshotId") String snapshotId,
                 @Param("code") String verificationCode,
                 @Param("now") Instant now,
                 @Param("pending") VerificationStatus pending,
                 @Param("webhookPending") WebhookStatus webhookPending,
                 @Param("verified") VerificationStatus verified);

    // The writes below are compare-and-set on (PENDING, snapshotId). A zero return means another
    // delivery path already resolved this job, or a newer job replaced it.

    default int completeVerified(Long id, String snapshotId, String profileData, Instant now) {
        return resolveVerified(id, snapshotId, profileData, now,
                VerificationStatus.PENDING, VerificationStatus.VERIFIED, WebhookStatus.COMPLETED);
    }

    default int completeFailed(Long id, String snapshotId, String profileData, Instant now) {
        return resolveFailed(id, snapshotId, profileData, now,
                VerificationStatus.PENDING, VerificationStatus.FAILED, WebhookStatus.COMPLETED);
    }

    default int markJobFailed(Long id, String snapshotId, Instant now) {
        return failJob(id, snapshotId, now, VerificationStatus.PENDING, VerificationStatus.FAILED, WebhookStatus.FAILED);
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SocialAccount a SET a.verificationStatus = :verified, a.webhookStatus = :completed,"
            + " a.profileData = :profileData, a.verificationAttempts = 0, a.updatedAt = :now"
            + " WHERE a.id = :id AND a.snapshotId = :snapshotId AND a.verificationStatus = :pending")
    int resolveVerified(@Param("id") Long id,
                        @Param("snapshotId") String snapshotId,
                        @Param("profileData") String profileData,
                        @Param("now") Instant now,
                        @Param("pending") VerificationStatus pending,
                        @Param("verified") VerificationStatus verified,
                        @Param("completed") WebhookStatus completed);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SocialAccount a SET a.verificationStatus = :failed, a.webhookStatus = :completed,"
            + " a.profileData = :profileData, a.verificationAttempts = a.verificationAttempts + 1, a.updatedAt = :now"
            + " WHERE a.id = :id AND a.snapshotId = :snapshotId AND a.verificationStatus = :pending")
    int resolveFailed(@Param("id") Long id,
                      @Param("snapshotId") String snapshotId,
                      @Param("profileData") String profileData,
                      @Param("now") Instant now,
                      @Param("pending") VerificationStatus pending,
                      @Param("failed") VerificationStatus failed,
                      @Param("completed") WebhookStatus completed);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SocialAccount a SET a.verificationStatus = :failed, a.webhookStatus = :webhookFailed,"
            + " a.verificationAttempts = a.verificationAttempts + 1, a.updatedAt = :now"
            + " WHERE a.id = :id AND a.snapshotId = :snapshotId AND a.verificationStatus = :pending")
    int failJob(@Param("id") Long id,
                @Param("snapshotId") String snapshotId,
                @Param("now") Instant now,
                @Param("pending") VerificationStatus pending,
                @Param("failed") VerificationStatus failed,
                @Param("webhookFailed") WebhookStatus webhookFailed);
}
