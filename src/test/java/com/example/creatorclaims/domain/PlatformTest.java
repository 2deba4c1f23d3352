package com.example.creatorclaims.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

@DisplayName("Platform Tests")
class PlatformTest {

    @ParameterizedTest
    @CsvSource({
            "https://www.tiktok.com/@alice/video/1, TIKTOK",
            "https://vm.tiktok.com/ZMabc/, TIKTOK",
            "https://www.instagram.com/reel/Cabc/, INSTAGRAM",
            "https://instagr.am/p/Cabc/, INSTAGRAM",
            "https://youtu.be/dQw4w9WgXcQ, YOUTUBE",
            "https://m.YouTube.com/watch?v=dQw4w9WgXcQ, YOUTUBE"
    })
    @DisplayName("detect should recognise supported hosts")
    void detect_SupportedHosts(String url, Platform expected) {
        assertThat(Platform.detect(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("detect should return null for other hosts")
    void detect_UnsupportedHost() {
        assertThat(Platform.detect("https://vimeo.com/12345")).isNull();
        assertThat(Platform.detect(null)).isNull();
    }

    @Test
    @DisplayName("fromValue should be case-insensitive and reject unknown names")
    void fromValue() {
        assertThat(Platform.fromValue(" Instagram ")).isEqualTo(Platform.INSTAGRAM);
        assertThat(Platform.TIKTOK.value()).isEqualTo("tiktok");
        assertThatIllegalArgumentException().isThrownBy(() -> Platform.fromValue("myspace"));
        assertThatIllegalArgumentException().isThrownBy(() -> Platform.fromValue(" "));
    }
}
