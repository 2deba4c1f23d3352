package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;

/**
 * Decides the initial ownership status of an upload before anything is written.
 */
public interface OwnershipPrecheck {

    record Decision(OwnershipStatus status, Long ownerSocialAccountId, String reason) {
    }

    /**
     * @throws org.springframework.web.server.ResponseStatusException 409 when the video is already
     *                                                                verified, by another user or by this user.
     */
    Decision check(Long userId, VideoFingerprint fingerprint, String videoUrl);
}
