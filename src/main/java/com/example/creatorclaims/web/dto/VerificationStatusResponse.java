package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.domain.SocialAccount.WebhookStatus;

public record VerificationStatusResponse(
        VerificationStatus verificationStatus,
        WebhookStatus webhookStatus,
        String verificationCode,
        String snapshotId,
        int verificationAttempts
) {

    public static VerificationStatusResponse fromEntity(SocialAccount account) {
        return new VerificationStatusResponse(
                account.getVerificationStatus(),
                account.getWebhookStatus(),
                account.getVerificationCode(),
                account.getSnapshotId(),
                account.getVerificationAttempts()
        );
    }
}
