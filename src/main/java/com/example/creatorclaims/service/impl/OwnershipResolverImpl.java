package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.ContestSubmission;
import com.example.creatorclaims.domain.OwnershipClaim.ClaimStatus;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.repository.ContestSubmissionRepository;
import com.example.creatorclaims.repository.OwnershipClaimRepository;
import com.example.creatorclaims.repository.RawVideoAssetRepository;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.OwnershipClaimRegistry;
import com.example.creatorclaims.service.OwnershipResolver;
import com.example.creatorclaims.service.SocialAccountMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@Service
public class OwnershipResolverImpl implements OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolverImpl.class);

    private static final EnumSet<OwnershipStatus> AWAITING_OWNERSHIP =
            EnumSet.of(OwnershipStatus.PENDING, OwnershipStatus.CONTESTED);
    private static final String LINKED_REASON = "Linked to connected account";
    private static final String SUBMISSION_LINKED_REASON = "Account linked, pending verification";
    private static final String VERIFIED_REASON = "Ownership verified via connected account";

    private final SocialAccountRepository accountRepository;
    private final RawVideoAssetRepository assetRepository;
    private final ContestSubmissionRepository submissionRepository;
    private final OwnershipClaimRepository claimRepository;
    private final OwnershipClaimRegistry claimRegistry;
    private final SocialAccountMatcher accountMatcher;

    public OwnershipResolverImpl(SocialAccountRepository accountRepository,
                                 RawVideoAssetRepository assetRepository,
                                 ContestSubmissionRepository submissionRepository,
                                 OwnershipClaimRepository claimRepository,
                                 OwnershipClaimRegistry claimRegistry,
                                 SocialAccountMatcher accountMatcher) {
        this.accountRepository = accountRepository;
        this.assetRepository = assetRepository;
        this.submissionRepository = submissionRepository;
        this.claimRepository = claimRepository;
        this.claimRegistry = claimRegistry;
        this.accountMatcher = accountMatcher;
    }

    @Override
    @Transactional
    public int associateAccount(Long socialAccountId) {
        Optional<SocialAccount> found = accountRepository.findById(socialAccountId);
        if (found.isEmpty()) {
            log.warn("[Resolver] Cannot associate unknown account {}", socialAccountId);
            return 0;
        }
        SocialAccount account = found.get();

        List<RawVideoAsset> unbound = assetRepository
                .findByUserIdAndPlatformAndOwnerSocialAccountIdIsNullAndOwnershipStatusIn(
                        account.getUserId(), account.getPlatform(), AWAITING_OWNERSHIP);
        int bound = 0;
        for (RawVideoAsset asset : unbound) {
            if (!accountMatcher.matchesVideoUrl(account, asset.getSourceUrl())
                    && !accountMatcher.matchesVideoUrl(account, asset.getVideoUrl())) {
                continue;
            }
            asset.setOwnerSocialAccountId(account.getId());
            asset.setOwnershipReason(LINKED_REASON);
            assetRepository.save(asset);
            for (ContestSubmission submission : submissionsFor(asset)) {
                if (submission.getSocialAccountId() == null) {
                    submission.setSocialAccountId(account.getId());
                    submission.setMp4OwnershipReason(SUBMISSION_LINKED_REASON);
                    submissionRepository.save(submission);
                }
            }
            bound++;
        }

        List<ContestSubmission> unboundSubmissions = submissionRepository
                .findByUserIdAndPlatformAndSocialAccountIdIsNull(account.getUserId(), account.getPlatform());
        for (ContestSubmission submission : unboundSubmissions) {
            if (accountMatcher.matchesVideoUrl(account, submission.getOriginalVideoUrl())) {
                submission.setSocialAccountId(account.getId());
                submission.setMp4OwnershipReason(SUBMISSION_LINKED_REASON);
                submissionRepository.save(submission);
            }
        }

        if (bound > 0) {
            log.info("[Resolver] Bound {} raw video asset(s) to account {}", bound, socialAccountId);
        }
        return bound;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Resolution resolveForAccount(Long socialAccountId) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        int associated = associateAccount(socialAccountId);

        SocialAccount account = accountRepository.findById(socialAccountId).orElse(null);
        if (account == null || account.getVerificationStatus() != VerificationStatus.VERIFIED) {
            log.info("[Resolver][TX:{}] Account {} is not verified, nothing to resolve", txName, socialAccountId);
            return new Resolution(associated, 0, 0);
        }

        // Claim rows are always locked in fingerprint order, so two resolvers cannot deadlock
        List<RawVideoAsset> candidates = assetRepository
                .findByOwnerSocialAccountIdAndOwnershipStatusInOrderByVideoFingerprintAsc(socialAccountId, AWAITING_OWNERSHIP);
        int promoted = 0;
        int disqualified = 0;
        for (RawVideoAsset candidate : candidates) {
            // Serializes resolvers working on the same video
            claimRepository.findForUpdate(candidate.getVideoFingerprint());

            RawVideoAsset asset = assetRepository.findById(candidate.getId()).orElse(null);
            if (asset == null || !asset.isAwaitingOwnership()) {
                continue;
            }

            Optional<RawVideoAsset> existingWinner = assetRepository
                    .findByVideoFingerprintAndOwnershipStatus(asset.getVideoFingerprint(), OwnershipStatus.VERIFIED)
                    .stream()
                    .filter(other -> !other.getId().equals(asset.getId()))
                    .findFirst();
            if (existingWinner.isPresent()) {
                String winnerHandle = handleOf(existingWinner.get().getOwnerSocialAccountId());
                log.info("[Resolver][TX:{}] Asset {} lost: fingerprint {} already owned by asset {}",
                        txName, asset.getId(), asset.getVideoFingerprint(), existingWinner.get().getId());
                disqualify(asset, winnerHandle);
                disqualified++;
                continue;
            }

            promote(asset, account);
            promoted++;
            disqualified += disqualifyCompetitors(asset, account, txName);
        }

        log.info("[Resolver][TX:{}] Account {} resolved: associated={}, promoted={}, disqualified={}",
                txName, socialAccountId, associated, promoted, disqualified);
        return new Resolution(associated, promoted, disqualified);
    }

    // Helper methods

    private void promote(RawVideoAsset asset, SocialAccount account) {
        asset.markVerified(account.getId(), VERIFIED_REASON);
        assetRepository.save(asset);

        claimRegistry.upsertClaim(asset.getVideoFingerprint(), asset.getPlatform(), asset.getId(),
                account.getUserId(), account.getId(), ClaimStatus.CLAIMED);

        Instant now = Instant.now();
        String reason = "Ownership verified for @" + displayHandle(account.getUsername(), "your account");
        for (ContestSubmission submission : submissionsFor(asset)) {
            submission.markOwnershipVerified(account.getId(), reason, now);
            submissionRepository.save(submission);
        }
    }

    private int disqualifyCompetitors(RawVideoAsset winner, SocialAccount account, String txName) {
        String winnerHandle = displayHandle(account.getUsername(), "verified creator");
        int count = 0;
        for (RawVideoAsset other : assetRepository.findByVideoFingerprint(winner.getVideoFingerprint())) {
            if (other.getId().equals(winner.getId())
                    || other.getOwnershipStatus() == OwnershipStatus.FAILED
                    || other.getOwnershipStatus() == OwnershipStatus.NOT_REQUIRED) {
                continue;
            }
            disqualify(other, winnerHandle);
            count++;
            log.info("[Resolver][TX:{}] Asset {} disqualified in favour of asset {} (@{})",
                    txName, other.getId(), winner.getId(), winnerHandle);
        }
        return count;
    }

    private void disqualify(RawVideoAsset asset, String winnerHandle) {
        asset.markFailed("Ownership claimed by @" + winnerHandle);
        assetRepository.save(asset);
        Instant now = Instant.now();
        for (ContestSubmission submission : submissionsFor(asset)) {
            submission.disqualify("Ownership claimed by @" + winnerHandle + ".", now);
            submissionRepository.save(submission);
        }
    }

    private List<ContestSubmission> submissionsFor(RawVideoAsset asset) {
        if (asset.getContestSubmissionId() != null) {
            return submissionRepository.findById(asset.getContestSubmissionId()).map(List::of).orElse(List.of());
        }
        return submissionRepository.findByRawVideoAssetId(asset.getId());
    }

    private String handleOf(Long socialAccountId) {
        if (socialAccountId == null) {
            return "verified creator";
        }
        return accountRepository.findById(socialAccountId)
                .map(owner -> displayHandle(owner.getUsername(), "verified creator"))
                .orElse("verified creator");
    }

    private static String displayHandle(String username, String fallback) {
        return (username == null || username.isBlank()) ? fallback : username;
    }
}
