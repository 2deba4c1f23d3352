package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.SocialAccount;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a video URL structurally belongs to a social account. Only the handle embedded
 * in the URL and the profile URL prefix count; loose substring matches are not accepted.
 */
@Component
public class SocialAccountMatcher {

    private final VideoFingerprintService fingerprintService;

    public SocialAccountMatcher(VideoFingerprintService fingerprintService) {
        this.fingerprintService = fingerprintService;
    }

    public boolean matchesVideoUrl(SocialAccount account, String videoUrl) {
        if (account == null || videoUrl == null || videoUrl.isBlank()) {
            return false;
        }
        String accountHandle = normalizeHandle(account.getUsername());
        String urlHandle = fingerprintService.extractHandle(account.getPlatform(), videoUrl);
        if (accountHandle != null && accountHandle.equals(urlHandle)) {
            return true;
        }

        String profileUrl = account.getProfileUrl();
        if (profileUrl == null || profileUrl.isBlank()) {
            return false;
        }
        String profilePrefix = stripScheme(profileUrl) + "/";
        return stripScheme(videoUrl).startsWith(profilePrefix);
    }

    public static String normalizeHandle(String handle) {
        if (handle == null) {
            return null;
        }
        String normalized = handle.trim().replace("@", "").toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    private static String stripScheme(String url) {
        String lower = url.trim().toLowerCase(Locale.ROOT);
        int schemeEnd = lower.indexOf("://");
        if (schemeEnd >= 0) {
            lower = lower.substring(schemeEnd + 3);
        }
        if (lower.startsWith("www.")) {
            lower = lower.substring(4);
        } else if (lower.startsWith("m.")) {
            lower = lower.substring(2);
        }
        while (lower.endsWith("/")) {
            lower = lower.substring(0, lower.length() - 1);
        }
        return lower;
    }
}
