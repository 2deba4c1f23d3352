package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.service.VideoFingerprint;
import com.example.creatorclaims.service.VideoFingerprintService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class VideoFingerprintServiceImpl implements VideoFingerprintService {

    private static final Logger log = LoggerFactory.getLogger(VideoFingerprintServiceImpl.class);

    private static final Pattern TIKTOK_VIDEO = Pattern.compile("/@([^/]+)/video/(\\d+)");
    private static final Pattern TIKTOK_BARE_VIDEO = Pattern.compile("/video/(\\d+)");
    private static final Pattern INSTAGRAM_POST = Pattern.compile("/(p|reels?|tv)/([A-Za-z0-9_-]+)");
    private static final Pattern INSTAGRAM_HANDLE = Pattern.compile("^/([^/]+)/(?:p|reels?|tv)/");
    private static final Pattern YOUTUBE_PATH_ID = Pattern.compile("^/(?:shorts|embed|live|v)/([A-Za-z0-9_-]{6,})");
    private static final Pattern YOUTUBE_SHORT_LINK = Pattern.compile("^/([A-Za-z0-9_-]{6,})");
    private static final Pattern YOUTUBE_QUERY_ID = Pattern.compile("(?:^|&)v=([A-Za-z0-9_-]{6,})");
    private static final Pattern YOUTUBE_HANDLE = Pattern.compile("^/@([^/]+)");

    @Override
    public VideoFingerprint fingerprint(Platform platform, String url) {
        if (platform == null) {
            throw new IllegalArgumentException("Platform is required to fingerprint a video URL");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Video URL must not be blank");
        }

        ParsedUrl parsed = parse(url.trim());
        String contentId = extractContentId(platform, parsed);

        if (contentId != null) {
            String canonicalUrl = canonicalUrl(platform, parsed, contentId);
            return new VideoFingerprint(platform.value() + ":" + contentId, platform, canonicalUrl, contentId, false);
        }

        String normalized = parsed.normalized(platform == Platform.YOUTUBE);
        log.debug("[Fingerprint] No {} content id in '{}', falling back to URL hash", platform.value(), normalized);
        return new VideoFingerprint(platform.value() + ":url:" + sha256Hex(normalized),
                platform, normalized, null, true);
    }

    @Override
    public String extractHandle(Platform platform, String url) {
        if (platform == null || url == null || url.isBlank()) {
            return null;
        }
        ParsedUrl parsed = parse(url.trim());
        Matcher matcher = switch (platform) {
            case TIKTOK -> TIKTOK_VIDEO.matcher(parsed.path());
            case INSTAGRAM -> INSTAGRAM_HANDLE.matcher(parsed.path());
            case YOUTUBE -> YOUTUBE_HANDLE.matcher(parsed.path());
        };
        if (!matcher.find()) {
            return null;
        }
        String handle = matcher.group(1).toLowerCase(Locale.ROOT).trim();
        return handle.isEmpty() ? null : handle;
    }

    // Helper methods

    private String extractContentId(Platform platform, ParsedUrl parsed) {
        String path = parsed.path();
        switch (platform) {
            case TIKTOK -> {
                Matcher matcher = TIKTOK_BARE_VIDEO.matcher(path);
                return matcher.find() ? matcher.group(1) : null;
            }
            case INSTAGRAM -> {
                Matcher matcher = INSTAGRAM_POST.matcher(path);
                return matcher.find() ? matcher.group(2) : null;
            }
            case YOUTUBE -> {
                if (parsed.host().equals("youtu.be")) {
                    Matcher matcher = YOUTUBE_SHORT_LINK.matcher(path);
                    return matcher.find() ? matcher.group(1) : null;
                }
                Matcher pathMatcher = YOUTUBE_PATH_ID.matcher(path);
                if (pathMatcher.find()) {
                    return pathMatcher.group(1);
                }
                if (path.equals("/watch") && parsed.query() != null) {
                    Matcher queryMatcher = YOUTUBE_QUERY_ID.matcher(parsed.query());
                    return queryMatcher.find() ? queryMatcher.group(1) : null;
                }
                return null;
            }
        }
        return null;
    }

    private String canonicalUrl(Platform platform, ParsedUrl parsed, String contentId) {
        return switch (platform) {
            case TIKTOK -> {
                Matcher matcher = TIKTOK_VIDEO.matcher(parsed.path());
                yield matcher.find()
                        ? "https://www.tiktok.com/@" + matcher.group(1) + "/video/" + contentId
                        : "https://www.tiktok.com/video/" + contentId;
            }
            case INSTAGRAM -> {
                Matcher matcher = INSTAGRAM_POST.matcher(parsed.path());
                String type = matcher.find() && !matcher.group(1).equals("p") ? "reel" : "p";
                yield "https://www.instagram.com/" + type + "/" + contentId;
            }
            case YOUTUBE -> "https://www.youtube.com/shorts/" + contentId;
        };
    }

    private ParsedUrl parse(String url) {
        String candidate = url.contains("://") ? url : "https://" + url;
        try {
            URI uri = new URI(candidate);
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            if (host.startsWith("www.")) {
                host = host.substring(4);
            } else if (host.startsWith("m.")) {
                host = host.substring(2);
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            return new ParsedUrl(host, path, uri.getRawQuery());
        } catch (URISyntaxException e) {
            log.debug("[Fingerprint] Unparseable URL '{}', using trimmed text: {}", url, e.getMessage());
            String stripped = url.split("[?#]", 2)[0];
            while (stripped.endsWith("/")) {
                stripped = stripped.substring(0, stripped.length() - 1);
            }
            return new ParsedUrl("", stripped.toLowerCase(Locale.ROOT), null);
        }
    }

    private String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private record ParsedUrl(String host, String path, String query) {

        String normalized(boolean keepYoutubeVideoParam) {
            StringBuilder sb = new StringBuilder("https://");
            sb.append(host).append(path);
            if (keepYoutubeVideoParam && query != null) {
                Matcher matcher = YOUTUBE_QUERY_ID.matcher(query);
                if (matcher.find()) {
                    sb.append("?v=").append(matcher.group(1));
                }
            }
            return sb.toString();
        }
    }
}
