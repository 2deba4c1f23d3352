package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.OwnershipClaim;
import com.example.creatorclaims.domain.OwnershipClaim.ClaimStatus;
import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.repository.OwnershipClaimRepository;
import com.example.creatorclaims.service.OwnershipClaimRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
public class OwnershipClaimRegistryImpl implements OwnershipClaimRegistry {

    private static final Logger log = LoggerFactory.getLogger(OwnershipClaimRegistryImpl.class);

    private final OwnershipClaimRepository claimRepository;

    public OwnershipClaimRegistryImpl(OwnershipClaimRepository claimRepository) {
        this.claimRepository = claimRepository;
    }

    @Override
    @Transactional
    public OwnershipClaim upsertClaim(String fingerprint, Platform platform, Long assetId, Long userId,
                                      Long socialAccountId, ClaimStatus status) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("Fingerprint is required to register a claim");
        }
        if (status == null) {
            throw new IllegalArgumentException("Claim status is required");
        }

        Optional<OwnershipClaim> existing = claimRepository.findForUpdate(fingerprint);
        if (existing.isEmpty()) {
            return insertClaim(fingerprint, platform, assetId, userId, socialAccountId, status);
        }

        OwnershipClaim claim = existing.get();
        ClaimStatus current = claim.getStatus();
        switch (status) {
            case CLAIMED -> {
                claim.assignOwner(assetId, userId, socialAccountId);
                claim.setStatus(ClaimStatus.CLAIMED);
                log.info("[ClaimRegistry] Fingerprint {} claimed by asset {} (account {}), previous status {}",
                        fingerprint, assetId, socialAccountId, current);
            }
            case CONTESTED -> {
                claim.recordContest(Instant.now());
                if (current != ClaimStatus.CLAIMED) {
                    claim.setStatus(ClaimStatus.CONTESTED);
                }
                log.info("[ClaimRegistry] Fingerprint {} contested by asset {} (count now {}, status {})",
                        fingerprint, assetId, claim.getContestedCount(), claim.getStatus());
            }
            case PENDING -> {
                if (current != ClaimStatus.UNCLAIMED) {
                    log.debug("[ClaimRegistry] Ignoring PENDING claim on fingerprint {} already {}", fingerprint, current);
                    return claim;
                }
                claim.assignOwner(assetId, userId, socialAccountId);
                claim.setStatus(ClaimStatus.PENDING);
                log.info("[ClaimRegistry] Fingerprint {} pending for asset {}", fingerprint, assetId);
            }
            case UNCLAIMED -> {
                log.debug("[ClaimRegistry] UNCLAIMED is never written over an existing claim ({})", fingerprint);
                return claim;
            }
        }
        return claimRepository.save(claim);
    }

    private OwnershipClaim insertClaim(String fingerprint, Platform platform, Long assetId, Long userId,
                                       Long socialAccountId, ClaimStatus status) {
        OwnershipClaim claim = new OwnershipClaim(fingerprint, platform);
        claim.assignOwner(assetId, userId, socialAccountId);
        claim.setStatus(status);
        if (status == ClaimStatus.CONTESTED) {
            claim.recordContest(Instant.now());
        }
        // A concurrent first insert for the same fingerprint fails on the primary key and rolls
        // back the caller; there is no row to lock before this point.
        OwnershipClaim saved = claimRepository.saveAndFlush(claim);
        log.info("[ClaimRegistry] Registered new claim on fingerprint {} with status {} (asset {})",
                fingerprint, status, assetId);
        return saved;
    }
}
