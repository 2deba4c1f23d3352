package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.ContestSubmission;
import com.example.creatorclaims.domain.OwnershipClaim.ClaimStatus;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.exceptions.AssetPersistenceException;
import com.example.creatorclaims.exceptions.UploadException;
import com.example.creatorclaims.exceptions.VideoStorageException;
import com.example.creatorclaims.repository.ContestSubmissionRepository;
import com.example.creatorclaims.repository.RawVideoAssetRepository;
import com.example.creatorclaims.service.OwnershipClaimRegistry;
import com.example.creatorclaims.service.RawVideoAssetDraft;
import com.example.creatorclaims.service.RawVideoAssetStore;
import com.example.creatorclaims.service.VideoFingerprint;
import com.example.creatorclaims.service.VideoStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

@Service
public class RawVideoAssetStoreImpl implements RawVideoAssetStore {

    private static final Logger log = LoggerFactory.getLogger(RawVideoAssetStoreImpl.class);

    private final VideoStorageService storageService;
    private final RawVideoAssetRepository assetRepository;
    private final ContestSubmissionRepository submissionRepository;
    private final OwnershipClaimRegistry claimRegistry;
    private final TransactionTemplate transactionTemplate;

    public RawVideoAssetStoreImpl(VideoStorageService storageService,
                                  RawVideoAssetRepository assetRepository,
                                  ContestSubmissionRepository submissionRepository,
                                  OwnershipClaimRegistry claimRegistry,
                                  TransactionTemplate transactionTemplate) {
        this.storageService = storageService;
        this.assetRepository = assetRepository;
        this.submissionRepository = submissionRepository;
        this.claimRegistry = claimRegistry;
        this.transactionTemplate = transactionTemplate;
    }

    // Not @Transactional: the object write must never sit inside the metadata transaction
    @Override
    public RawVideoAsset store(MultipartFile file, RawVideoAssetDraft draft) {
        String storagePath = draft.storagePath();
        try {
            storageService.store(file, storagePath);
        } catch (VideoStorageException e) {
            log.error("[AssetStore] Object write failed for user {} at {}: {}", draft.userId(), storagePath, e.getMessage());
            throw new UploadException("Failed to upload video to storage", e);
        }

        try {
            RawVideoAsset saved = transactionTemplate.execute(status -> insertMetadata(file, draft));
            log.info("[AssetStore] Stored raw video asset {} ({}, ownership {}) for user {}",
                    saved.getId(), draft.fingerprint().key(), saved.getOwnershipStatus(), draft.userId());
            return saved;
        } catch (RuntimeException e) {
            log.warn("[AssetStore] Metadata insert failed for object {}, deleting it: {}", storagePath, e.getMessage());
            boolean orphaned = false;
            try {
                storageService.delete(storagePath);
            } catch (VideoStorageException deleteEx) {
                orphaned = true;
                log.error("[AssetStore] Compensating delete failed, object {} is orphaned", storagePath, deleteEx);
            }
            throw new AssetPersistenceException("Failed to save raw video metadata", e, orphaned);
        }
    }

    private RawVideoAsset insertMetadata(MultipartFile file, RawVideoAssetDraft draft) {
        VideoFingerprint fingerprint = draft.fingerprint();
        RawVideoAsset asset = new RawVideoAsset(
                draft.userId(),
                draft.submissionType(),
                fingerprint.platform(),
                fingerprint.canonicalUrl(),
                fingerprint.key(),
                draft.storagePath(),
                file.getSize(),
                file.getContentType()
        );
        asset.setSourceUrl(draft.sourceUrl());
        asset.setFingerprintLowConfidence(fingerprint.lowConfidence());
        asset.setContestSubmissionId(draft.contestSubmissionId());
        asset.setOwnershipReason(draft.ownershipReason());
        asset.setOwnerSocialAccountId(draft.ownerSocialAccountId());
        if (draft.ownershipStatus() == OwnershipStatus.VERIFIED) {
            asset.markVerified(draft.ownerSocialAccountId(), draft.ownershipReason());
        } else {
            asset.setOwnershipStatus(draft.ownershipStatus());
        }

        RawVideoAsset saved = assetRepository.save(asset);

        if (draft.contestSubmissionId() != null) {
            ContestSubmission submission = submissionRepository.findById(draft.contestSubmissionId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Contest submission " + draft.contestSubmissionId() + " disappeared during upload"));
            submission.attachRawVideo(saved.getId(), saved.getOwnershipStatus(), saved.getOwnerSocialAccountId());
            submissionRepository.save(submission);
        }

        ClaimStatus claimStatus = toClaimStatus(saved.getOwnershipStatus());
        if (claimStatus != null) {
            claimRegistry.upsertClaim(fingerprint.key(), fingerprint.platform(), saved.getId(),
                    saved.getUserId(), saved.getOwnerSocialAccountId(), claimStatus);
        } else {
            log.debug("[AssetStore] No claim registered for asset {} with ownership {}", saved.getId(), saved.getOwnershipStatus());
        }
        return saved;
    }

    private ClaimStatus toClaimStatus(OwnershipStatus ownershipStatus) {
        return switch (ownershipStatus) {
            case PENDING -> ClaimStatus.PENDING;
            case VERIFIED -> ClaimStatus.CLAIMED;
            case CONTESTED -> ClaimStatus.CONTESTED;
            case FAILED, NOT_REQUIRED -> null;
        };
    }
}
