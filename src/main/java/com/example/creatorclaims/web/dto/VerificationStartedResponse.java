package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.service.SocialAccountVerifier.VerificationRequest;

public record VerificationStartedResponse(String verificationCode, String snapshotId) {

    public static VerificationStartedResponse from(VerificationRequest request) {
        return new VerificationStartedResponse(request.verificationCode(), request.snapshotId());
    }
}
