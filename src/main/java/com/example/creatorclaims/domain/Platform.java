package com.example.creatorclaims.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Social platforms whose videos and profiles can be claimed.
 */
public enum Platform {
    TIKTOK,
    INSTAGRAM,
    YOUTUBE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Platform must not be blank");
        }
        return Platform.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Detects the platform from a video or profile URL by host.
     *
     * @return the platform, or null when the host is not a supported platform.
     */
    public static Platform detect(String url) {
        if (url == null) {
            return null;
        }
        String normalized = url.toLowerCase(Locale.ROOT);
        if (normalized.contains("tiktok.com")) {
            return TIKTOK;
        }
        if (normalized.contains("instagram.com") || normalized.contains("instagr.am")) {
            return INSTAGRAM;
        }
        if (normalized.contains("youtube.com") || normalized.contains("youtu.be")) {
            return YOUTUBE;
        }
        return null;
    }
}
