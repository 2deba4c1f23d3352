package com.example.creatorclaims.provider;

import com.example.creatorclaims.domain.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Reads the bio text out of a scraped profile and looks for a verification code in it.
 */
@Component
public class ProfileBioExtractor {

    private static final List<String> TIKTOK_FIELDS =
            List.of("biography", "signature", "bio", "bio_text", "description");
    private static final List<String> INSTAGRAM_FIELDS =
            List.of("biography", "account.biography", "account.bio", "bio", "bio_text", "description");
    private static final List<String> YOUTUBE_FIELDS =
            List.of("Description", "description", "about", "about_text", "bio", "bio_text");

    /**
     * @return the first non-blank bio field for the platform, or an empty string.
     */
    public String extractBio(JsonNode profile, Platform platform) {
        if (profile == null) {
            return "";
        }
        List<String> fields = switch (platform) {
            case TIKTOK -> TIKTOK_FIELDS;
            case INSTAGRAM -> INSTAGRAM_FIELDS;
            case YOUTUBE -> YOUTUBE_FIELDS;
        };
        for (String field : fields) {
            JsonNode current = profile;
            for (String segment : field.split("\\.")) {
                current = current == null ? null : current.get(segment);
            }
            if (current != null && current.isTextual() && !current.asText().isBlank()) {
                return current.asText().trim();
            }
        }
        return "";
    }

    /**
     * Case-insensitive substring match after collapsing whitespace runs in the bio.
     */
    public boolean containsCode(String bio, String verificationCode) {
        if (bio == null || bio.isBlank() || verificationCode == null || verificationCode.isBlank()) {
            return false;
        }
        String normalizedBio = bio.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
        return normalizedBio.contains(verificationCode.trim().toLowerCase(Locale.ROOT));
    }
}
