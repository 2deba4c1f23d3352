package com.example.creatorclaims.web.dto;

import com.example.creatorclaims.service.VerificationReconciler.ReconcileResult;

public record ReconcileResponse(int processed, int verified, int failed, int stillPending) {

    public static ReconcileResponse from(ReconcileResult result) {
        return new ReconcileResponse(result.processed(), result.verified(), result.failed(), result.stillPending());
    }
}
