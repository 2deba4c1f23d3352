package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.OwnershipClaim;
import com.example.creatorclaims.domain.OwnershipClaim.ClaimStatus;
import com.example.creatorclaims.domain.Platform;

/**
 * Single source of truth for who currently owns a video fingerprint.
 */
public interface OwnershipClaimRegistry {

    /**
     * Records a claim attempt on a fingerprint. Joins the caller's transaction and locks the
     * existing claim row for its duration.
     * <ul>
     *     <li>No row yet: inserts one with the given status; the contest counter starts at 1 for CONTESTED, else 0.</li>
     *     <li>CLAIMED: the owner fields are overwritten, the contest counter is kept.</li>
     *     <li>CONTESTED: the counter is incremented and stamped; a CLAIMED row stays CLAIMED.</li>
     *     <li>PENDING: applied only to an UNCLAIMED row, never weakens a stronger claim.</li>
     * </ul>
     *
     * @return the claim row after the update.
     */
    OwnershipClaim upsertClaim(String fingerprint, Platform platform, Long assetId, Long userId,
                               Long socialAccountId, ClaimStatus status);
}
