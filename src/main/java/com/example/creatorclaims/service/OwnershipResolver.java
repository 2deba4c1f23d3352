package com.example.creatorclaims.service;

/**
 * Turns a verified social account into video ownership: binds the account's unbound uploads,
 * promotes them, and disqualifies every competing upload of the same video.
 * The first account to verify for a fingerprint wins; losers are never reinstated automatically.
 */
public interface OwnershipResolver {

    record Resolution(int associated, int promoted, int disqualified) {
    }

    /**
     * Binds the account to its user's unbound assets and submissions on the same platform whose
     * video URL carries the account's handle or sits under its profile URL.
     *
     * @return number of assets newly bound.
     */
    int associateAccount(Long socialAccountId);

    /**
     * Associates, then resolves ownership for every pending or contested asset bound to the
     * account. Does nothing unless the account is VERIFIED. Idempotent.
     */
    Resolution resolveForAccount(Long socialAccountId);
}
