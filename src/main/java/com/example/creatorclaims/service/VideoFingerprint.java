package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;

/**
 * Content identity of a platform video.
 *
 * @param key           stable grouping key, {@code <platform>:<contentId>} or a URL hash when low-confidence
 * @param platform      platform the URL belongs to
 * @param canonicalUrl  URL with tracking parameters, fragments and host variations removed
 * @param contentId     platform video id, null when it could not be extracted
 * @param lowConfidence true when the key is a hash of the URL rather than a platform video id
 */
public record VideoFingerprint(String key,
                               Platform platform,
                               String canonicalUrl,
                               String contentId,
                               boolean lowConfidence) {
}
