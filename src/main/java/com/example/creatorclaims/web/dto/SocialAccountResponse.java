package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;

import java.time.Instant;

/**
 * A linked social account as shown to its owner. The verification code is included so the
 * owner can paste it into their bio.
 */
public record SocialAccountResponse(
        Long id,
        Platform platform,
        String profileUrl,
        String username,
        VerificationStatus verificationStatus,
        String verificationCode,
        Instant createdAt
) {

    public static SocialAccountResponse fromEntity(SocialAccount account) {
        if (account == null) {
            throw new NullPointerException("Cannot create SocialAccountResponse from null SocialAccount entity");
        }
        return new SocialAccountResponse(
                account.getId(),
                account.getPlatform(),
                account.getProfileUrl(),
                account.getUsername(),
                account.getVerificationStatus(),
                account.getVerificationCode(),
                account.getCreatedAt()
        );
    }
}
