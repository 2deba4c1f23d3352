package com.example.creatorclaims.web.controller;

import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.service.SocialAccountService;
import com.example.creatorclaims.service.SocialAccountVerifier;
import com.example.creatorclaims.web.dto.LinkSocialAccountRequest;
import com.example.creatorclaims.web.dto.SocialAccountResponse;
import com.example.creatorclaims.web.dto.VerificationStartedResponse;
import com.example.creatorclaims.web.dto.VerificationStatusResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/social-accounts")
public class SocialAccountController {

    private static final Logger log = LoggerFactory.getLogger(SocialAccountController.class);

    private final SocialAccountService socialAccountService;
    private final SocialAccountVerifier verifier;

    public SocialAccountController(SocialAccountService socialAccountService, SocialAccountVerifier verifier) {
        this.socialAccountService = socialAccountService;
        this.verifier = verifier;
    }

    @PostMapping
    public ResponseEntity<SocialAccountResponse> linkAccount(@Valid @RequestBody LinkSocialAccountRequest request,
                                                             Authentication authentication) {
        Long userId = AuthenticatedUser.id(authentication);
        log.info("Link request from user {} for {} profile {}", userId, request.platform(), request.profileUrl());
        SocialAccount account = socialAccountService.linkAccount(
                userId, request.platform(), request.profileUrl(), request.username());
        return ResponseEntity.status(HttpStatus.CREATED).body(SocialAccountResponse.fromEntity(account));
    }

    @GetMapping
    public ResponseEntity<List<SocialAccountResponse>> listAccounts(Authentication authentication) {
        Long userId = AuthenticatedUser.id(authentication);
        List<SocialAccountResponse> accounts = socialAccountService.listAccounts(userId).stream()
                .map(SocialAccountResponse::fromEntity)
                .toList();
        log.debug("Returning {} social accounts for user {}", accounts.size(), userId);
        return ResponseEntity.ok(accounts);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable Long id, Authentication authentication) {
        socialAccountService.deleteAccount(id, AuthenticatedUser.id(authentication));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/verify")
    public ResponseEntity<VerificationStartedResponse> requestVerification(@PathVariable Long id,
                                                                           Authentication authentication) {
        Long userId = AuthenticatedUser.id(authentication);
        log.info("Verification requested for account {} by user {}", id, userId);
        SocialAccountVerifier.VerificationRequest started = verifier.requestVerification(id, userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(VerificationStartedResponse.from(started));
    }

    @GetMapping("/{id}/verification")
    public ResponseEntity<VerificationStatusResponse> getVerificationStatus(@PathVariable Long id,
                                                                            Authentication authentication) {
        SocialAccount account = socialAccountService.getVerificationState(id, AuthenticatedUser.id(authentication));
        return ResponseEntity.ok(VerificationStatusResponse.fromEntity(account));
    }
}
