package com.example.creatorclaims.repository;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import org.springframework.data.repository.CrudRepository;

import java.util.Collection;
import java.util.List;

public interface RawVideoAssetRepository extends CrudRepository<RawVideoAsset, Long> {

    List<RawVideoAsset> findByVideoFingerprint(String videoFingerprint);

    List<RawVideoAsset> findByVideoFingerprintAndOwnershipStatus(String videoFingerprint, OwnershipStatus status);

    /**
     * An account's assets in fingerprint order. Resolvers lock claim rows in this order.
     */
    List<RawVideoAsset> findByOwnerSocialAccountIdAndOwnershipStatusInOrderByVideoFingerprintAsc(
            Long ownerSocialAccountId, Collection<OwnershipStatus> statuses);

    /**
     * Assets a user uploaded for a platform that are not yet bound to any social account.
     */
    List<RawVideoAsset> findByUserIdAndPlatformAndOwnerSocialAccountIdIsNullAndOwnershipStatusIn(
            Long userId, Platform platform, Collection<OwnershipStatus> statuses);
}
