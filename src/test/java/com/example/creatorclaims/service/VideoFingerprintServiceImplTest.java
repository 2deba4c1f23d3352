package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.service.impl.VideoFingerprintServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VideoFingerprintServiceImpl Tests")
class VideoFingerprintServiceImplTest {

    private final VideoFingerprintServiceImpl fingerprintService = new VideoFingerprintServiceImpl();

    @Nested
    @DisplayName("fingerprint")
    class Fingerprint {

        @Test
        @DisplayName("✅ Tracking parameters do not change the key")
        void trackingParametersIgnored() {
            VideoFingerprint clean = fingerprintService.fingerprint(Platform.TIKTOK,
                    "https://www.tiktok.com/@creator/video/7234567890123456789");
            VideoFingerprint tracked = fingerprintService.fingerprint(Platform.TIKTOK,
                    "https://www.tiktok.com/@creator/video/7234567890123456789?is_from_webapp=1&sender_device=pc#comments");

            assertThat(tracked.key()).isEqualTo(clean.key()).isEqualTo("tiktok:7234567890123456789");
            assertThat(tracked.canonicalUrl()).isEqualTo("https://www.tiktok.com/@creator/video/7234567890123456789");
            assertThat(tracked.lowConfidence()).isFalse();
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({
                "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=42s",
                "https://youtu.be/dQw4w9WgXcQ?si=abc",
                "https://m.youtube.com/shorts/dQw4w9WgXcQ",
                "youtube.com/embed/dQw4w9WgXcQ"
        })
        @DisplayName("✅ YouTube URL variants share one key")
        void youtubeVariants(String url) {
            VideoFingerprint fingerprint = fingerprintService.fingerprint(Platform.YOUTUBE, url);

            assertThat(fingerprint.key()).isEqualTo("youtube:dQw4w9WgXcQ");
            assertThat(fingerprint.canonicalUrl()).isEqualTo("https://www.youtube.com/shorts/dQw4w9WgXcQ");
        }

        @Test
        @DisplayName("✅ Instagram reel and reels paths share one key")
        void instagramReels() {
            VideoFingerprint reel = fingerprintService.fingerprint(Platform.INSTAGRAM,
                    "https://www.instagram.com/reel/Cx1AbC_d-9/?igsh=xyz");
            VideoFingerprint reels = fingerprintService.fingerprint(Platform.INSTAGRAM,
                    "https://instagram.com/reels/Cx1AbC_d-9");

            assertThat(reel.key()).isEqualTo(reels.key()).isEqualTo("instagram:Cx1AbC_d-9");
            assertThat(reel.canonicalUrl()).isEqualTo("https://www.instagram.com/reel/Cx1AbC_d-9");
        }

        @Test
        @DisplayName("✅ URL without a content id falls back to a low-confidence hash")
        void fallbackHash() {
            VideoFingerprint first = fingerprintService.fingerprint(Platform.TIKTOK,
                    "https://vm.tiktok.com/ZMabc123/?utm_source=share");
            VideoFingerprint second = fingerprintService.fingerprint(Platform.TIKTOK,
                    "https://vm.tiktok.com/ZMabc123/");

            assertThat(first.lowConfidence()).isTrue();
            assertThat(first.contentId()).isNull();
            assertThat(first.key()).startsWith("tiktok:url:").isEqualTo(second.key());
        }

        @Test
        @DisplayName("❌ Blank URL is rejected")
        void blankUrl() {
            assertThatThrownBy(() -> fingerprintService.fingerprint(Platform.TIKTOK, "  "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("extractHandle")
    class ExtractHandle {

        @Test
        @DisplayName("✅ TikTok handle is lower-cased")
        void tiktokHandle() {
            assertThat(fingerprintService.extractHandle(Platform.TIKTOK,
                    "https://www.tiktok.com/@Creator.One/video/123")).isEqualTo("creator.one");
        }

        @Test
        @DisplayName("✅ Instagram handle only when it prefixes the post path")
        void instagramHandle() {
            assertThat(fingerprintService.extractHandle(Platform.INSTAGRAM,
                    "https://www.instagram.com/someone/reel/Cx1AbC")).isEqualTo("someone");
            assertThat(fingerprintService.extractHandle(Platform.INSTAGRAM,
                    "https://www.instagram.com/reel/Cx1AbC")).isNull();
        }

        @Test
        @DisplayName("✅ YouTube watch URL carries no handle")
        void youtubeWithoutHandle() {
            assertThat(fingerprintService.extractHandle(Platform.YOUTUBE,
                    "https://www.youtube.com/watch?v=dQw4w9WgXcQ")).isNull();
        }
    }
}
