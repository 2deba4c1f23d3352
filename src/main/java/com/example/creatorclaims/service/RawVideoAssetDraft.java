package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;

/**
 * Everything needed to persist one uploaded raw video, decided before the object is written.
 */
public record RawVideoAssetDraft(Long userId,
                                 SubmissionType submissionType,
                                 Long contestSubmissionId,
                                 VideoFingerprint fingerprint,
                                 String sourceUrl,
                                 String storagePath,
                                 OwnershipStatus ownershipStatus,
                                 Long ownerSocialAccountId,
                                 String ownershipReason) {
}
