package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.OwnershipResolver;
import com.example.creatorclaims.service.ProfileUrlPolicy;
import com.example.creatorclaims.service.SocialAccountMatcher;
import com.example.creatorclaims.service.SocialAccountService;
import com.example.creatorclaims.service.VerificationCodeGenerator;
import com.example.creatorclaims.service.VerificationReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

@Service
public class SocialAccountServiceImpl implements SocialAccountService {

    private static final Logger log = LoggerFactory.getLogger(SocialAccountServiceImpl.class);
    private static final String ACCOUNT_NOT_FOUND_MESSAGE = "Social account not found";

    private final SocialAccountRepository accountRepository;
    private final ProfileUrlPolicy profileUrlPolicy;
    private final VerificationCodeGenerator codeGenerator;
    private final OwnershipResolver ownershipResolver;
    private final VerificationReconciler reconciler;

    public SocialAccountServiceImpl(SocialAccountRepository accountRepository,
                                    ProfileUrlPolicy profileUrlPolicy,
                                    VerificationCodeGenerator codeGenerator,
                                    OwnershipResolver ownershipResolver,
                                    VerificationReconciler reconciler) {
        this.accountRepository = accountRepository;
        this.profileUrlPolicy = profileUrlPolicy;
        this.codeGenerator = codeGenerator;
        this.ownershipResolver = ownershipResolver;
        this.reconciler = reconciler;
    }

    @Override
    @Transactional
    public SocialAccount linkAccount(Long userId, Platform platform, String profileUrl, String username) {
        String normalizedUrl;
        try {
            normalizedUrl = profileUrlPolicy.normalize(profileUrl);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid profile URL", e);
        }
        if (!profileUrlPolicy.isValidProfileUrl(normalizedUrl, platform)) {
            log.warn("Link rejected for user {}: '{}' is not a {} profile URL", userId, normalizedUrl, platform.value());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid profile URL for " + platform.value());
        }

        String handle = SocialAccountMatcher.normalizeHandle(username);
        if (handle == null) {
            handle = profileUrlPolicy.extractUsername(normalizedUrl, platform);
        }
        if (handle == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Could not determine the username from the profile URL, please provide it");
        }

        Optional<SocialAccount> sameUrl = accountRepository.findByPlatformAndProfileUrl(platform, normalizedUrl);
        if (sameUrl.isPresent()) {
            if (sameUrl.get().getUserId().equals(userId)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "This account is already linked");
            }
            throw new ResponseStatusException(HttpStatus.CONFLICT, "This account is already linked to another user");
        }
        boolean verifiedElsewhere = accountRepository.findByPlatformAndUsernameIgnoreCase(platform, handle).stream()
                .anyMatch(other -> !other.getUserId().equals(userId)
                        && other.getVerificationStatus() == VerificationStatus.VERIFIED);
        if (verifiedElsewhere) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "@" + handle + " has already been verified by another user");
        }

        SocialAccount account = new SocialAccount(userId, platform, normalizedUrl, handle, codeGenerator.generateUniqueCode());
        SocialAccount saved = accountRepository.save(account);
        log.info("User {} linked {} account @{} (id {})", userId, platform.value(), handle, saved.getId());

        ownershipResolver.associateAccount(saved.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SocialAccount> listAccounts(Long userId) {
        return accountRepository.findByUserIdOrderByCreatedAtAsc(userId);
    }

    @Override
    @Transactional
    public void deleteAccount(Long accountId, Long userId) {
        SocialAccount account = findOwnedOrThrow(accountId, userId);
        accountRepository.delete(account);
        log.info("User {} removed social account {} (@{})", userId, accountId, account.getUsername());
    }

    // Not @Transactional: the poll commits through the verifier's own transaction before the re-read
    @Override
    public SocialAccount getVerificationState(Long accountId, Long userId) {
        SocialAccount account = findOwnedOrThrow(accountId, userId);
        if (!account.isAwaitingResult()) {
            return account;
        }
        VerificationReconciler.AccountOutcome outcome = reconciler.reconcileAccount(account);
        log.debug("On-demand poll for account {} returned {}", accountId, outcome);
        if (outcome == VerificationReconciler.AccountOutcome.STILL_PENDING) {
            return account;
        }
        return findOwnedOrThrow(accountId, userId);
    }

    private SocialAccount findOwnedOrThrow(Long accountId, Long userId) {
        return accountRepository.findByIdAndUserId(accountId, userId)
                .orElseThrow(() -> {
                    log.warn("Social account {} not found for user {}", accountId, userId);
                    return new ResponseStatusException(HttpStatus.NOT_FOUND, ACCOUNT_NOT_FOUND_MESSAGE);
                });
    }
}
