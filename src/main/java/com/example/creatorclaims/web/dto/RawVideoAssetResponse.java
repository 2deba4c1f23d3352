package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;

import java.time.Instant;

/**
 * Upload result. The storage path stays server-side.
 */
public record RawVideoAssetResponse(
        Long id,
        SubmissionType submissionType,
        Long contestSubmissionId,
        Platform platform,
        String videoUrl,
        String videoFingerprint,
        Long sizeBytes,
        Instant uploadedAt,
        OwnershipStatus ownershipStatus,
        Long ownerSocialAccountId,
        String ownershipReason
) {

    public static RawVideoAssetResponse fromEntity(RawVideoAsset asset) {
        if (asset == null) {
            throw new NullPointerException("Cannot create RawVideoAssetResponse from null RawVideoAsset entity");
        }
        return new RawVideoAssetResponse(
                asset.getId(),
                asset.getSubmissionType(),
                asset.getContestSubmissionId(),
                asset.getPlatform(),
                asset.getVideoUrl(),
                asset.getVideoFingerprint(),
                asset.getSizeBytes(),
                asset.getUploadedAt(),
                asset.getOwnershipStatus(),
                asset.getOwnerSocialAccountId(),
                asset.getOwnershipReason()
        );
    }
}
