package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;

import java.util.List;

/**
 * Linking, listing and removing a user's social accounts.
 */
public interface SocialAccountService {

    /**
     * Links a profile as UNVERIFIED with a fresh verification code, then binds any of the user's
     * unbound uploads that match it.
     *
     * @throws org.springframework.web.server.ResponseStatusException 400 for an invalid or already linked URL,
     *                                                                409 when another user linked or verified it.
     */
    SocialAccount linkAccount(Long userId, Platform platform, String profileUrl, String username);

    List<SocialAccount> listAccounts(Long userId);

    /**
     * @throws org.springframework.web.server.ResponseStatusException 404 if the account is not the user's.
     */
    void deleteAccount(Long accountId, Long userId);

    /**
     * Returns the account's verification state. An account still waiting on a provider job is
     * polled once first, so the answer reflects a finished job even if no webhook has arrived.
     *
     * @throws org.springframework.web.server.ResponseStatusException 404 if the account is not the user's.
     */
    SocialAccount getVerificationState(Long accountId, Long userId);
}
