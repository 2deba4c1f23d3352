package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.repository.RawVideoAssetRepository;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.OwnershipPrecheck;
import com.example.creatorclaims.service.SocialAccountMatcher;
import com.example.creatorclaims.service.VideoFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

@Service
public class OwnershipPrecheckImpl implements OwnershipPrecheck {

    private static final Logger log = LoggerFactory.getLogger(OwnershipPrecheckImpl.class);

    private final RawVideoAssetRepository assetRepository;
    private final SocialAccountRepository accountRepository;
    private final SocialAccountMatcher accountMatcher;

    public OwnershipPrecheckImpl(RawVideoAssetRepository assetRepository,
                                 SocialAccountRepository accountRepository,
                                 SocialAccountMatcher accountMatcher) {
        this.assetRepository = assetRepository;
        this.accountRepository = accountRepository;
        this.accountMatcher = accountMatcher;
    }

    @Override
    @Transactional(readOnly = true)
    public Decision check(Long userId, VideoFingerprint fingerprint, String videoUrl) {
        List<RawVideoAsset> sameVideo = assetRepository.findByVideoFingerprint(fingerprint.key());

        Optional<RawVideoAsset> verified = sameVideo.stream()
                .filter(asset -> asset.getOwnershipStatus() == OwnershipStatus.VERIFIED)
                .findFirst();
        if (verified.isPresent()) {
            RawVideoAsset winner = verified.get();
            if (winner.getUserId().equals(userId)) {
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "You have already uploaded this video with verified ownership");
            }
            String owner = accountRepository.findById(winner.getOwnerSocialAccountId())
                    .map(SocialAccount::getUsername)
                    .orElse("another user");
            log.info("Upload rejected for user {}: {} already claimed by asset {}", userId, fingerprint.key(), winner.getId());
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "This video is already claimed by @" + owner + ". Only the original creator can submit this video.");
        }

        List<SocialAccount> candidates = accountRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
                .filter(account -> account.getPlatform() == fingerprint.platform())
                .filter(account -> accountMatcher.matchesVideoUrl(account, videoUrl))
                .toList();

        Optional<SocialAccount> verifiedMatch = candidates.stream()
                .filter(account -> account.getVerificationStatus() == VerificationStatus.VERIFIED)
                .findFirst();
        if (verifiedMatch.isPresent()) {
            SocialAccount account = verifiedMatch.get();
            return new Decision(OwnershipStatus.VERIFIED, account.getId(),
                    "Ownership verified via connected account @" + account.getUsername());
        }

        Long boundAccountId = candidates.isEmpty() ? null : candidates.get(0).getId();
        boolean othersWaiting = sameVideo.stream()
                .anyMatch(asset -> !asset.getUserId().equals(userId) && asset.isAwaitingOwnership());
        if (othersWaiting) {
            return new Decision(OwnershipStatus.CONTESTED, boundAccountId,
                    "Multiple users have submitted this video. Connect your social account to verify ownership.");
        }
        return new Decision(OwnershipStatus.PENDING, boundAccountId,
                boundAccountId != null
                        ? "Account linked, pending verification"
                        : "Connect and verify your social account to confirm ownership.");
    }
}
