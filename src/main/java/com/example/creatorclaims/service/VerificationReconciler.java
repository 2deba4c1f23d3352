package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.SocialAccount;

/**
 * Pull-side delivery of provider results: polls outstanding jobs and feeds finished ones into
 * {@link SocialAccountVerifier#ingestResult}. Safe to run concurrently with itself and with the webhook.
 */
public interface VerificationReconciler {

    enum AccountOutcome {
        VERIFIED,
        FAILED,
        STILL_PENDING,
        ALREADY_RESOLVED
    }

    /**
     * @param processed    accounts whose job resolved during this run (verified, failed, or already resolved elsewhere)
     * @param verified     accounts that became VERIFIED
     * @param failed       accounts that became FAILED, by mismatch or by provider failure
     * @param stillPending accounts left untouched because the job is not done or the provider call errored
     */
    record ReconcileResult(int processed, int verified, int failed, int stillPending) {
    }

    /**
     * Runs one bounded batch over accounts waiting on a job. Never fails because of a single account.
     */
    ReconcileResult reconcile();

    /**
     * Polls the provider for one account's job and applies the result if it is ready.
     * Provider errors leave the account pending.
     */
    AccountOutcome reconcileAccount(SocialAccount account);
}
