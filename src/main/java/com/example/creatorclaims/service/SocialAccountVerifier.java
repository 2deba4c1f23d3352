package com.example.creatorclaims.service;

import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Drives one provider verification job per social account and applies its result exactly once.
 * Webhook deliveries and reconciler polls both end up in {@link #ingestResult}.
 */
public interface SocialAccountVerifier {

    enum IngestOutcome {
        VERIFIED,
        FAILED,
        /** The job was already resolved, or replaced by a newer job. Nothing was written. */
        ALREADY_RESOLVED,
        /** No account is waiting on this snapshot id. */
        UNKNOWN_SNAPSHOT
    }

    record VerificationRequest(Long accountId, String verificationCode, String snapshotId) {
    }

    /**
     * Starts (or restarts) verification for one of the caller's accounts. A retry out of FAILED
     * clears the stored profile data; any earlier job id is replaced and its late deliveries ignored.
     *
     * @throws org.springframework.web.server.ResponseStatusException 404 if the account is not the user's,
     *                                                                409 if it is already verified.
     * @throws ExternalProviderException                              if the provider is misconfigured or refuses the job.
     */
    VerificationRequest requestVerification(Long accountId, Long userId);

    /**
     * Applies a fetched profile to the account waiting on {@code snapshotId}. The write only
     * happens while the account is still PENDING on that same snapshot id.
     */
    IngestOutcome ingestResult(Long accountId, String snapshotId, JsonNode profileData);

    /**
     * Same as {@link #ingestResult} but locates the account by its snapshot id.
     */
    IngestOutcome ingestResultForSnapshot(String snapshotId, JsonNode profileData);

    /**
     * Records a terminal provider failure for the job.
     *
     * @return true if the account moved to FAILED, false if the job was already resolved or unknown.
     */
    boolean markJobFailed(String snapshotId);
}
