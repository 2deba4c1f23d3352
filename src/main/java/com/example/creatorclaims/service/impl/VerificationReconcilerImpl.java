package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.example.creatorclaims.provider.ScraperProviderClient;
import com.example.creatorclaims.provider.SnapshotStatus;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.SocialAccountVerifier;
import com.example.creatorclaims.service.SocialAccountVerifier.IngestOutcome;
import com.example.creatorclaims.service.VerificationReconciler;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class VerificationReconcilerImpl implements VerificationReconciler {

    private static final Logger log = LoggerFactory.getLogger(VerificationReconcilerImpl.class);

    private final SocialAccountRepository accountRepository;
    private final ScraperProviderClient providerClient;
    private final SocialAccountVerifier verifier;
    private final int batchSize;

    public VerificationReconcilerImpl(SocialAccountRepository accountRepository,
                                      ScraperProviderClient providerClient,
                                      SocialAccountVerifier verifier,
                                      @Value("${verification.reconcile.batch-size:50}") int batchSize) {
        this.accountRepository = accountRepository;
        this.providerClient = providerClient;
        this.verifier = verifier;
        this.batchSize = batchSize;
    }

    @Override
    public ReconcileResult reconcile() {
        List<SocialAccount> pending = accountRepository.findAwaitingResult(PageRequest.of(0, batchSize));
        if (pending.isEmpty()) {
            log.debug("[Reconciler] No accounts waiting on a provider job");
            return new ReconcileResult(0, 0, 0, 0);
        }
        log.info("[Reconciler] Checking {} account(s) waiting on a provider job", pending.size());

        int processed = 0;
        int verified = 0;
        int failed = 0;
        int stillPending = 0;
        for (SocialAccount account : pending) {
            AccountOutcome outcome;
            try {
                outcome = reconcileAccount(account);
            } catch (RuntimeException e) {
                log.error("[Reconciler] Unexpected error on account {} (job {}), leaving it pending",
                        account.getId(), account.getSnapshotId(), e);
                outcome = AccountOutcome.STILL_PENDING;
            }
            switch (outcome) {
                case VERIFIED -> {
                    processed++;
                    verified++;
                }
                case FAILED -> {
                    processed++;
                    failed++;
                }
                case ALREADY_RESOLVED -> processed++;
                case STILL_PENDING -> stillPending++;
            }
        }

        log.info("[Reconciler] Completed: processed={}, verified={}, failed={}, stillPending={}",
                processed, verified, failed, stillPending);
        return new ReconcileResult(processed, verified, failed, stillPending);
    }

    @Override
    public AccountOutcome reconcileAccount(SocialAccount account) {
        Long accountId = account.getId();
        String snapshotId = account.getSnapshotId();
        if (!account.isAwaitingResult()) {
            return AccountOutcome.ALREADY_RESOLVED;
        }

        try {
            SnapshotStatus status = providerClient.getSnapshotStatus(snapshotId);
            switch (status) {
                case NOT_READY, NOT_FOUND -> {
                    log.debug("[Reconciler] Job {} for account {} is {}", snapshotId, accountId, status);
                    return AccountOutcome.STILL_PENDING;
                }
                case FAILED -> {
                    return verifier.markJobFailed(snapshotId) ? AccountOutcome.FAILED : AccountOutcome.ALREADY_RESOLVED;
                }
                case READY -> {
                    Optional<JsonNode> profile = providerClient.fetchSnapshotData(snapshotId);
                    if (profile.isEmpty()) {
                        log.debug("[Reconciler] Job {} reported ready but has no data yet", snapshotId);
                        return AccountOutcome.STILL_PENDING;
                    }
                    IngestOutcome outcome = verifier.ingestResult(accountId, snapshotId, profile.get());
                    return switch (outcome) {
                        case VERIFIED -> AccountOutcome.VERIFIED;
                        case FAILED -> AccountOutcome.FAILED;
                        case ALREADY_RESOLVED, UNKNOWN_SNAPSHOT -> AccountOutcome.ALREADY_RESOLVED;
                    };
                }
            }
        } catch (ExternalProviderException e) {
            log.warn("[Reconciler] Provider error for account {} (job {}), leaving it pending: {}",
                    accountId, snapshotId, e.getMessage());
            return AccountOutcome.STILL_PENDING;
        }
        return AccountOutcome.STILL_PENDING;
    }
}
