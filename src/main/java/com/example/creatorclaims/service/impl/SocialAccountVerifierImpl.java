package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.events.SocialAccountVerifiedEvent;
import com.example.creatorclaims.provider.ProfileBioExtractor;
import com.example.creatorclaims.provider.ScraperProviderClient;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.SocialAccountVerifier;
import com.example.creatorclaims.service.VerificationCodeGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Optional;

@Service
public class SocialAccountVerifierImpl implements SocialAccountVerifier {

    private static final Logger log = LoggerFactory.getLogger(SocialAccountVerifierImpl.class);
    private static final String ACCOUNT_NOT_FOUND_MESSAGE = "Social account not found";
    private static final String YOUTUBE_ABOUT_SUFFIX = "/about";

    private final SocialAccountRepository accountRepository;
    private final ScraperProviderClient providerClient;
    private final ProfileBioExtractor bioExtractor;
    private final VerificationCodeGenerator codeGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public SocialAccountVerifierImpl(SocialAccountRepository accountRepository,
                                     ScraperProviderClient providerClient,
                                     ProfileBioExtractor bioExtractor,
                                     VerificationCodeGenerator codeGenerator,
                                     ApplicationEventPublisher eventPublisher,
                                     ObjectMapper objectMapper) {
        this.accountRepository = accountRepository;
        this.providerClient = providerClient;
        this.bioExtractor = bioExtractor;
        this.codeGenerator = codeGenerator;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
    }

    // Not @Transactional: no database transaction is held open across the provider call.
    // The closing write is conditional instead.
    @Override
    public VerificationRequest requestVerification(Long accountId, Long userId) {
        SocialAccount account = accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> {
                    log.warn("[Verifier] Verification requested for unknown account {} by user {}", accountId, userId);
                    return new ResponseStatusException(HttpStatus.NOT_FOUND, ACCOUNT_NOT_FOUND_MESSAGE);
                });

        if (account.getVerificationStatus() == VerificationStatus.VERIFIED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Account is already verified");
        }

        // Fail fast on configuration before any job exists
        providerClient.assertConfigured(account.getPlatform());

        VerificationStatus previousStatus = account.getVerificationStatus();
        String previousSnapshot = account.getSnapshotId();
        String code = account.getVerificationCode();
        if (code == null || code.isBlank()) {
            code = codeGenerator.generateUniqueCode();
        }

        String snapshotId = providerClient.triggerProfileScrape(
                account.getPlatform(), scrapeTargetUrl(account.getPlatform(), account.getProfileUrl()));

        // A result for the previous job may have committed while the trigger call was in flight
        if (accountRepository.startJob(accountId, snapshotId, code, Instant.now()) == 0) {
            log.warn("[Verifier] Account {} was verified while job {} was being requested, job {} left orphaned",
                    accountId, previousSnapshot, snapshotId);
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Account is already verified");
        }

        if (previousSnapshot != null) {
            log.info("[Verifier] Account {} moved {} -> PENDING on job {}, superseding job {}",
                    accountId, previousStatus, snapshotId, previousSnapshot);
        } else {
            log.info("[Verifier] Account {} moved {} -> PENDING on job {}", accountId, previousStatus, snapshotId);
        }
        String storedCode = accountRepository.findById(accountId)
                .map(SocialAccount::getVerificationCode)
                .orElse(code);
        return new VerificationRequest(accountId, storedCode, snapshotId);
    }

    @Override
    @Transactional
    public IngestOutcome ingestResult(Long accountId, String snapshotId, JsonNode profileData) {
        String txName = TransactionSynchronizationManager.getCurrentTransactionName();
        Optional<SocialAccount> found = accountRepository.findById(accountId);
        if (found.isEmpty()) {
            log.warn("[Verifier][TX:{}] Result for job {} names unknown account {}", txName, snapshotId, accountId);
            return IngestOutcome.UNKNOWN_SNAPSHOT;
        }
        SocialAccount account = found.get();
        if (account.getVerificationStatus() != VerificationStatus.PENDING
                || snapshotId == null || !snapshotId.equals(account.getSnapshotId())) {
            log.info("[Verifier][TX:{}] Ignoring result for job {} on account {} (status {}, current job {})",
                    txName, snapshotId, accountId, account.getVerificationStatus(), account.getSnapshotId());
            return IngestOutcome.ALREADY_RESOLVED;
        }

        Platform platform = account.getPlatform();
        Long userId = account.getUserId();
        String bio = bioExtractor.extractBio(profileData, platform);
        boolean codeFound = bioExtractor.containsCode(bio, account.getVerificationCode());
        String rawProfile = serialize(profileData);
        Instant now = Instant.now();

        int updated = codeFound
                ? accountRepository.completeVerified(accountId, snapshotId, rawProfile, now)
                : accountRepository.completeFailed(accountId, snapshotId, rawProfile, now);

        if (updated == 0) {
            log.info("[Verifier][TX:{}] Job {} for account {} was resolved concurrently, no change applied",
                    txName, snapshotId, accountId);
            return IngestOutcome.ALREADY_RESOLVED;
        }

        if (codeFound) {
            log.info("[Verifier][TX:{}] Account {} VERIFIED by job {}", txName, accountId, snapshotId);
            eventPublisher.publishEvent(new SocialAccountVerifiedEvent(this, accountId, userId, platform, snapshotId));
            return IngestOutcome.VERIFIED;
        }
        log.info("[Verifier][TX:{}] Account {} FAILED by job {}: code not found in bio ({} chars)",
                txName, accountId, snapshotId, bio.length());
        return IngestOutcome.FAILED;
    }

    @Override
    @Transactional
    public IngestOutcome ingestResultForSnapshot(String snapshotId, JsonNode profileData) {
        if (snapshotId == null || snapshotId.isBlank()) {
            return IngestOutcome.UNKNOWN_SNAPSHOT;
        }
        return accountRepository.findBySnapshotId(snapshotId)
                .map(account -> ingestResult(account.getId(), snapshotId, profileData))
                .orElseGet(() -> {
                    log.warn("[Verifier] No account waiting on job {}, result ignored", snapshotId);
                    return IngestOutcome.UNKNOWN_SNAPSHOT;
                });
    }

    @Override
    @Transactional
    public boolean markJobFailed(String snapshotId) {
        Optional<SocialAccount> found = accountRepository.findBySnapshotId(snapshotId);
        if (found.isEmpty()) {
            log.warn("[Verifier] Failure notice for unknown job {} ignored", snapshotId);
            return false;
        }
        Long accountId = found.get().getId();
        int updated = accountRepository.markJobFailed(accountId, snapshotId, Instant.now());
        if (updated == 0) {
            log.info("[Verifier] Failure notice for job {} ignored, account {} already resolved", snapshotId, accountId);
            return false;
        }
        log.info("[Verifier] Account {} FAILED: provider reported job {} failed", accountId, snapshotId);
        return true;
    }

    // Helper methods

    /**
     * YouTube only shows the channel description on the about page.
     */
    static String scrapeTargetUrl(Platform platform, String profileUrl) {
        if (platform != Platform.YOUTUBE || profileUrl.contains(YOUTUBE_ABOUT_SUFFIX)) {
            return profileUrl;
        }
        return profileUrl.endsWith("/") ? profileUrl + "about" : profileUrl + YOUTUBE_ABOUT_SUFFIX;
    }

    private String serialize(JsonNode profileData) {
        if (profileData == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(profileData);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize provider profile payload", e);
        }
    }
}
