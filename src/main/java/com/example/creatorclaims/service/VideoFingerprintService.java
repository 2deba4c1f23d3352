package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;

/**
 * Canonicalizes platform video URLs into content identity keys.
 */
public interface VideoFingerprintService {

    /**
     * Computes the fingerprint of a video URL. Deterministic, and stable against tracking
     * parameters, fragments, host case and {@code www.}/{@code m.} prefixes.
     *
     * @param platform the platform the URL belongs to.
     * @param url      the video URL as submitted.
     * @return the fingerprint.
     * @throws IllegalArgumentException if the URL is blank.
     */
    VideoFingerprint fingerprint(Platform platform, String url);

    /**
     * Extracts the creator handle embedded in a video URL, lower-cased without {@code @}.
     *
     * @return the handle, or null when the URL does not carry one (e.g. youtu.be links).
     */
    String extractHandle(Platform platform, String url);
}
