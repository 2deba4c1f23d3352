package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Profile URL rules for linking accounts: which URLs are profiles, their normalized form, and the handle they name.
 */
@Component
public class ProfileUrlPolicy {

    private static final Set<String> INSTAGRAM_RESERVED = Set.of("p", "reel", "reels", "stories", "explore", "accounts", "tv");
    private static final Pattern FIRST_SEGMENT = Pattern.compile("^/([^/]+)");
    private static final Pattern AT_HANDLE = Pattern.compile("^/@([^/]+)");
    private static final Pattern YOUTUBE_NAMED = Pattern.compile("^/(?:c|user)/([^/]+)");

    /**
     * Adds https when missing, drops query, fragment and trailing slashes.
     *
     * @throws IllegalArgumentException if the value is not a URL.
     */
    public String normalize(String profileUrl) {
        if (profileUrl == null || profileUrl.isBlank()) {
            throw new IllegalArgumentException("Profile URL must not be blank");
        }
        String candidate = profileUrl.trim();
        if (!candidate.startsWith("http://") && !candidate.startsWith("https://")) {
            candidate = "https://" + candidate;
        }
        try {
            URI uri = new URI(candidate);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Profile URL has no host: " + profileUrl);
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            return "https://" + uri.getHost().toLowerCase(Locale.ROOT) + path;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid profile URL: " + profileUrl, e);
        }
    }

    /**
     * @param normalizedUrl a URL produced by {@link #normalize}.
     */
    public boolean isValidProfileUrl(String normalizedUrl, Platform platform) {
        URI uri = URI.create(normalizedUrl);
        String host = uri.getHost();
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return switch (platform) {
            case TIKTOK -> host.contains("tiktok.com") && (path.startsWith("/@") || host.equals("vm.tiktok.com"));
            case INSTAGRAM -> {
                if (!host.contains("instagram.com")) {
                    yield false;
                }
                Matcher matcher = FIRST_SEGMENT.matcher(path);
                yield matcher.find() && !INSTAGRAM_RESERVED.contains(matcher.group(1).toLowerCase(Locale.ROOT));
            }
            case YOUTUBE -> {
                if (!host.contains("youtube.com")) {
                    yield false;
                }
                String withoutAbout = path.replaceFirst("/about$", "");
                yield withoutAbout.startsWith("/@") || withoutAbout.startsWith("/c/")
                        || withoutAbout.startsWith("/channel/") || withoutAbout.startsWith("/user/");
            }
        };
    }

    /**
     * @return the lower-cased handle named by the profile URL, or null when it carries none
     * (short links, channel ids).
     */
    public String extractUsername(String normalizedUrl, Platform platform) {
        String path = URI.create(normalizedUrl).getRawPath();
        if (path == null) {
            return null;
        }
        Matcher matcher = switch (platform) {
            case TIKTOK -> AT_HANDLE.matcher(path);
            case INSTAGRAM -> FIRST_SEGMENT.matcher(path);
            case YOUTUBE -> AT_HANDLE.matcher(path).find() ? AT_HANDLE.matcher(path) : YOUTUBE_NAMED.matcher(path);
        };
        if (!matcher.find()) {
            return null;
        }
        String handle = matcher.group(1);
        if (platform == Platform.INSTAGRAM && INSTAGRAM_RESERVED.contains(handle.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return SocialAccountMatcher.normalizeHandle(handle);
    }
}
